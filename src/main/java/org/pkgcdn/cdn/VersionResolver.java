package org.pkgcdn.cdn;

import org.pkgcdn.cdn.dto.PackageInfo;
import org.semver4j.RangesList;
import org.semver4j.RangesListFactory;
import org.semver4j.Semver;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * 把 URL 中的版本标识解析为精确版本。
 * <p>
 * 判定顺序固定：
 * <ol>
 *   <li>是已发布版本的 key：精确版本，直接使用。</li>
 *   <li>是 dist-tag：取 tag 指向的版本（需要重定向）。</li>
 *   <li>按 semver range 取满足条件的最大版本（需要重定向）。</li>
 * </ol>
 * 都不满足时返回 null。
 */
public class VersionResolver {

    private static final Set<String> KEYWORD_ALIASES = Set.of("latest", "latest.integration");
    private static final String IVY_BRACKETS = "[]()";

    public Resolution resolve(PackageInfo info, String versionToken) {
        if (info.versions().containsKey(versionToken)) {
            return new Resolution(Kind.EXACT, versionToken);
        }
        String tagged = info.distTags().get(versionToken);
        if (tagged != null) {
            return new Resolution(Kind.TAG, tagged);
        }
        String maxVersion = maxSatisfying(info.versions().keySet(), versionToken);
        if (maxVersion != null) {
            return new Resolution(Kind.RANGE, maxVersion);
        }
        return null;
    }

    /**
     * 满足 range 的最大版本；range 无法解析或没有满足的版本时为 null。
     * <p>
     * range 按 npm 的语法理解：
     * <ul>
     *   <li>{@code latest}、{@code latest.integration} 不是 range（semver4j 会把它们当成 {@code *}）。</li>
     *   <li>Ivy 风格的 {@code [1.0,2.0)} 不是 range。</li>
     *   <li>单独的 {@code x}/{@code X} 等同于 {@code *}。</li>
     * </ul>
     */
    public static String maxSatisfying(Collection<String> versions, String range) {
        RangesList ranges = parseRange(range);
        if (ranges == null) {
            return null;
        }

        String bestKey = null;
        Semver best = null;
        for (String version : versions) {
            Semver candidate = Semver.parse(version);
            if (candidate == null) {
                continue;
            }
            if (ranges.isSatisfiedBy(candidate) && (best == null || candidate.isGreaterThan(best))) {
                best = candidate;
                bestKey = version;
            }
        }
        return bestKey;
    }

    static RangesList parseRange(String range) {
        if (range == null) {
            return null;
        }
        String trimmed = range.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (KEYWORD_ALIASES.contains(lower) || containsAny(trimmed, IVY_BRACKETS)) {
            return null;
        }
        String normalized = "x".equals(lower) ? "*" : trimmed;
        try {
            return RangesListFactory.create(normalized);
        } catch (IllegalArgumentException e) {
            // 非法 range（SemverException 也是 IllegalArgumentException）：任何版本都不会满足
            return null;
        }
    }

    private static boolean containsAny(String value, String characters) {
        for (int i = 0; i < characters.length(); i++) {
            if (value.indexOf(characters.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * 是否是合法的精确版本号（只有精确版本才对应缓存目录）。
     */
    public static boolean isExactVersion(String versionToken) {
        return Semver.parse(versionToken) != null;
    }

    public enum Kind {
        EXACT,
        TAG,
        RANGE
    }

    public record Resolution(Kind kind, String version) {

        public boolean needsRedirect() {
            return kind != Kind.EXACT;
        }
    }
}
