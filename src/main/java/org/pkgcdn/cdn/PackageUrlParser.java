package org.pkgcdn.cdn;

import org.pkgcdn.cdn.dto.PackageRequest;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * 包 URL 解析器：把 {@code /name@version/file?query} 解析成 {@link PackageRequest}。
 * <p>
 * 支持的形式：
 * <ul>
 *   <li>{@code /history@1.12.5/umd/History.min.js}</li>
 *   <li>{@code /history@1.12.5}（文件取 package.json 的 main）</li>
 *   <li>{@code /history}、{@code /history/umd/History.min.js}（版本缺省为 latest）</li>
 *   <li>{@code /@scope/name@^1/index.js}（scope 占两段路径）</li>
 * </ul>
 * 非法 URL 返回 {@code null}，不抛异常。{@code ..} 不在这里处理，由缓存目录的受控拼接负责。
 */
public final class PackageUrlParser {

    static final String DEFAULT_VERSION = "latest";

    private PackageUrlParser() {
    }

    /**
     * @param pathname 请求路径（未解码）
     * @param query    原始查询串（不含 ?），可以为 null
     * @return 解析结果；URL 不合法时为 null
     */
    public static PackageRequest parse(String pathname, String query) {
        if (pathname == null || pathname.length() < 2 || pathname.charAt(0) != '/') {
            return null;
        }

        // 包名段的结束位置：普通包是第一个 /，scope 包是第二个 /
        int segmentEnd = pathname.indexOf('/', 1);
        if (pathname.charAt(1) == '@') {
            if (segmentEnd < 0 || segmentEnd == 2) {
                return null;
            }
            segmentEnd = pathname.indexOf('/', segmentEnd + 1);
        }
        if (segmentEnd < 0) {
            segmentEnd = pathname.length();
        }

        String packageSegment = pathname.substring(1, segmentEnd);
        String rawFilename = pathname.substring(segmentEnd);

        // 版本分隔符是包名段中最后一个 @，scope 开头的 @ 除外
        int nameStart = packageSegment.startsWith("@") ? packageSegment.indexOf('/') + 1 : 0;
        int at = packageSegment.lastIndexOf('@');
        String packageName;
        String version;
        if (at >= nameStart && at > 0) {
            packageName = packageSegment.substring(0, at);
            version = decode(packageSegment.substring(at + 1));
            if (version == null || version.isEmpty()) {
                return null;
            }
        } else {
            packageName = packageSegment;
            version = DEFAULT_VERSION;
        }

        if (packageName.length() <= nameStart) {
            return null;
        }

        String filename = decode(rawFilename);
        if (filename == null) {
            return null;
        }

        String search = (query == null || query.isEmpty()) ? "" : "?" + query;
        return new PackageRequest(packageName, version, filename, search);
    }

    private static String decode(String value) {
        try {
            return UriUtils.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // 非法的 % 转义
            return null;
        }
    }
}
