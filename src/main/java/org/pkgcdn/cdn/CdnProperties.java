package org.pkgcdn.cdn;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 包 CDN 的业务配置（{@code app.cdn.*}），启动时读取一次，运行期间不变。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #registryUrl}：上游包注册中心地址，元数据与 tarball 都从这里拉取。</li>
 *   <li>{@link #cacheDir}：解包后的本地缓存根目录（每个 name@version 一个子目录）。</li>
 *   <li>{@link #redirectTtl}/{@link #fileTtl}：重定向与文件响应的缓存时长。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.cdn")
public class CdnProperties {

    /**
     * 包注册中心地址（末尾不带 /）。
     */
    @NotBlank
    private String registryUrl = "https://registry.npmjs.org";

    /**
     * 触发“打包下载”的特殊文件名（相对包根目录，以 / 开头）。
     */
    @NotBlank
    private String bundlePath = "/bower.zip";

    /**
     * tag/range 重定向的缓存时长；0 表示不下发 Cache-Control。
     */
    @NotNull
    private Duration redirectTtl = Duration.ZERO;

    /**
     * 已固定版本的文件与目录列表的缓存时长（版本内容不可变，默认一年）。
     */
    @NotNull
    private Duration fileTtl = Duration.ofDays(365);

    /**
     * 请求的路径是目录时，是否自动生成 JSON 目录列表。
     */
    private boolean autoIndex = true;

    /**
     * 目录列表的最大递归深度（0 表示只返回目录本身，不展开子项）。
     */
    @Min(0)
    private int maximumDepth = Integer.MAX_VALUE;

    /**
     * 本地缓存根目录；为空时使用 {@code ${java.io.tmpdir}/pkgcdn}。
     */
    private String cacheDir;

    /**
     * 目录列表并发 stat 使用的线程数。
     */
    @Min(1)
    @Max(256)
    private int treeStatThreads = 8;

    /**
     * 访问注册中心的连接超时。
     */
    @NotNull
    private Duration registryConnectTimeout = Duration.ofSeconds(5);

    /**
     * 访问注册中心的读取超时（tarball 下载同样适用）。
     */
    @NotNull
    private Duration registryReadTimeout = Duration.ofSeconds(30);

    public String getRegistryUrl() {
        return registryUrl;
    }

    public void setRegistryUrl(String registryUrl) {
        this.registryUrl = registryUrl;
    }

    public String getBundlePath() {
        return bundlePath;
    }

    public void setBundlePath(String bundlePath) {
        this.bundlePath = bundlePath;
    }

    public Duration getRedirectTtl() {
        return redirectTtl;
    }

    public void setRedirectTtl(Duration redirectTtl) {
        this.redirectTtl = redirectTtl;
    }

    public Duration getFileTtl() {
        return fileTtl;
    }

    public void setFileTtl(Duration fileTtl) {
        this.fileTtl = fileTtl;
    }

    public boolean isAutoIndex() {
        return autoIndex;
    }

    public void setAutoIndex(boolean autoIndex) {
        this.autoIndex = autoIndex;
    }

    public int getMaximumDepth() {
        return maximumDepth;
    }

    public void setMaximumDepth(int maximumDepth) {
        this.maximumDepth = maximumDepth;
    }

    public String getCacheDir() {
        return cacheDir;
    }

    public void setCacheDir(String cacheDir) {
        this.cacheDir = cacheDir;
    }

    public int getTreeStatThreads() {
        return treeStatThreads;
    }

    public void setTreeStatThreads(int treeStatThreads) {
        this.treeStatThreads = treeStatThreads;
    }

    public Duration getRegistryConnectTimeout() {
        return registryConnectTimeout;
    }

    public void setRegistryConnectTimeout(Duration registryConnectTimeout) {
        this.registryConnectTimeout = registryConnectTimeout;
    }

    public Duration getRegistryReadTimeout() {
        return registryReadTimeout;
    }

    public void setRegistryReadTimeout(Duration registryReadTimeout) {
        this.registryReadTimeout = registryReadTimeout;
    }

    /**
     * 解析后的缓存根目录（绝对路径）。
     */
    public Path resolveCacheRoot() {
        String configured = cacheDir;
        if (configured == null || configured.isBlank()) {
            return Path.of(System.getProperty("java.io.tmpdir"), "pkgcdn").toAbsolutePath().normalize();
        }
        return Path.of(configured).toAbsolutePath().normalize();
    }
}
