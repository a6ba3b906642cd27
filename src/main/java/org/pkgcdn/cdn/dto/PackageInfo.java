package org.pkgcdn.cdn.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * 注册中心返回的包元数据（只保留解析版本需要的部分）。
 *
 * @param name     包名
 * @param versions 已发布版本 -> 该版本的 package.json（含 dist.tarball）
 * @param distTags dist-tag -> 精确版本
 */
public record PackageInfo(
        String name,
        Map<String, JsonNode> versions,
        Map<String, String> distTags
) {

    /**
     * 某个版本的 tarball 下载地址；版本不存在或缺少 dist.tarball 时为 null。
     */
    public String tarballUrl(String version) {
        JsonNode manifest = versions.get(version);
        if (manifest == null) {
            return null;
        }
        JsonNode tarball = manifest.path("dist").path("tarball");
        return tarball.isTextual() ? tarball.asText() : null;
    }

    /**
     * 某个版本 tarball 的 sha1 校验值（dist.shasum）；没有时为 null。
     */
    public String shasum(String version) {
        JsonNode manifest = versions.get(version);
        if (manifest == null) {
            return null;
        }
        JsonNode shasum = manifest.path("dist").path("shasum");
        return shasum.isTextual() ? shasum.asText() : null;
    }
}
