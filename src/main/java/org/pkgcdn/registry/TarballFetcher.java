package org.pkgcdn.registry;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 下载并解包 tarball 到缓存目录。
 * <p>
 * 实现必须保证：成功时目标目录完整可用；失败时目标目录下不会留下 package.json（缓存判断仍然是“未缓存”）。
 */
public interface TarballFetcher {

    /**
     * @param tarballUrl      tarball 下载地址
     * @param expectedShasum  期望的 sha1（十六进制）；为 null 时不校验
     * @param destination     目标目录（不存在时创建）
     */
    void fetchAndExtract(String tarballUrl, String expectedShasum, Path destination) throws IOException;
}
