package org.pkgcdn.cdn.dto;

/**
 * 解析后的包请求：{@code /name@version/filename?search}。
 *
 * @param packageName  包名（可带 scope，例如 {@code @babel/core}）
 * @param versionToken 版本标识：精确版本、dist-tag 或 semver range（URL 未指定时为 {@code latest}）
 * @param filename     包内文件路径（以 / 开头，原样保留结尾的 /）；未指定时为空串
 * @param search       原始查询串（含开头的 ?）；没有时为空串
 */
public record PackageRequest(
        String packageName,
        String versionToken,
        String filename,
        String search
) {

    public boolean hasFilename() {
        return !filename.isEmpty();
    }

    /**
     * {@code name@version}，用于日志与 404 提示。
     */
    public String displayName() {
        return packageName + "@" + versionToken;
    }

    /**
     * 以另一个版本号重建同一文件的 URL（filename 与 search 不变）。
     */
    public String toUrl(String version) {
        return createUrl(packageName, version, filename, search);
    }

    /**
     * 拼装 {@code /name@version/filename?search}；version/filename/search 为空时省略对应部分。
     */
    public static String createUrl(String packageName, String version, String filename, String search) {
        StringBuilder url = new StringBuilder("/").append(packageName);
        if (version != null && !version.isEmpty()) {
            url.append('@').append(version);
        }
        if (filename != null) {
            url.append(filename);
        }
        if (search != null) {
            url.append(search);
        }
        return url.toString();
    }
}
