package org.pkgcdn.cdn;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;
import org.pkgcdn.cdn.dto.PackageInfo;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VersionResolverTest {

    private final VersionResolver resolver = new VersionResolver();

    @Test
    void resolve_exactVersionNeedsNoRedirect() {
        VersionResolver.Resolution resolution = resolver.resolve(info(), "1.0.0");

        assertThat(resolution.kind()).isEqualTo(VersionResolver.Kind.EXACT);
        assertThat(resolution.version()).isEqualTo("1.0.0");
        assertThat(resolution.needsRedirect()).isFalse();
    }

    @Test
    void resolve_distTagRedirectsToTaggedVersion() {
        VersionResolver.Resolution resolution = resolver.resolve(info(), "latest");

        assertThat(resolution.kind()).isEqualTo(VersionResolver.Kind.TAG);
        assertThat(resolution.version()).isEqualTo("1.2.0");
        assertThat(resolution.needsRedirect()).isTrue();
    }

    @Test
    void resolve_rangePicksHighestSatisfyingVersion() {
        VersionResolver.Resolution resolution = resolver.resolve(info(), "^1");

        assertThat(resolution.kind()).isEqualTo(VersionResolver.Kind.RANGE);
        assertThat(resolution.version()).isEqualTo("1.2.0");
        assertThat(resolution.needsRedirect()).isTrue();
    }

    @Test
    void resolve_returnsNullWhenNothingMatches() {
        assertThat(resolver.resolve(info(), "^9.0.0")).isNull();
        assertThat(resolver.resolve(info(), "3.0.0")).isNull();
    }

    @Test
    void resolve_latestWithoutDistTagIsNotARange() {
        PackageInfo untagged = new PackageInfo("demo", info().versions(), Map.of());

        assertThat(resolver.resolve(untagged, "latest")).isNull();
    }

    @Test
    void maxSatisfying_followsNpmRangeKeywords() {
        List<String> versions = List.of("1.0.0", "1.2.0", "2.0.0-beta.1");

        assertThat(VersionResolver.maxSatisfying(versions, "latest")).isNull();
        assertThat(VersionResolver.maxSatisfying(versions, "latest.integration")).isNull();
        assertThat(VersionResolver.maxSatisfying(versions, "x")).isEqualTo("1.2.0");
        assertThat(VersionResolver.maxSatisfying(versions, "X")).isEqualTo("1.2.0");
        assertThat(VersionResolver.maxSatisfying(versions, "*")).isEqualTo("1.2.0");
        assertThat(VersionResolver.maxSatisfying(versions, "1.x")).isEqualTo("1.2.0");
        assertThat(VersionResolver.maxSatisfying(versions, "[1.0,2.0)")).isNull();
    }

    @Test
    void maxSatisfying_ignoresUnparseableVersions() {
        assertThat(VersionResolver.maxSatisfying(List.of("not-a-version", "1.0.1", "1.0.3", "1.1.0"), "~1.0.0"))
                .isEqualTo("1.0.3");
    }

    @Test
    void isExactVersion_acceptsOnlyFullVersions() {
        assertThat(VersionResolver.isExactVersion("1.2.3")).isTrue();
        assertThat(VersionResolver.isExactVersion("1.2.3-beta.1")).isTrue();
        assertThat(VersionResolver.isExactVersion("latest")).isFalse();
        assertThat(VersionResolver.isExactVersion("^1.2.3")).isFalse();
    }

    private static PackageInfo info() {
        Map<String, JsonNode> versions = new LinkedHashMap<>();
        for (String version : List.of("1.0.0", "1.2.0", "2.0.0", "2.0.0-rc.1", "0.9.0")) {
            versions.put(version, JsonNodeFactory.instance.objectNode());
        }
        return new PackageInfo("demo", versions, Map.of("latest", "1.2.0", "next", "2.0.0-rc.1"));
    }
}
