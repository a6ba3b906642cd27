package org.pkgcdn.registry;

import org.pkgcdn.cdn.PackageCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

/**
 * 基于 Spring {@link RestClient} 的 tarball 下载 + 解包实现。
 * <p>
 * 流程：
 * <ol>
 *   <li>下载到目标目录同级的临时文件（保证与目标目录在同一文件系统内）。</li>
 *   <li>有 {@code dist.shasum} 时校验 sha1。</li>
 *   <li>解包到同级的临时目录，再通过 ATOMIC_MOVE 重命名为目标目录。</li>
 * </ol>
 * 同一个 name@version 的并发请求可能各自下载；先完成的一方发布目录，后完成的一方丢弃自己的临时目录。
 * 失败时临时文件/目录都会被清理，目标目录下不会出现 package.json。
 */
public class HttpTarballFetcher implements TarballFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpTarballFetcher.class);
    private static final Logger outboundRequestLog = LoggerFactory.getLogger("registry.outbound");

    private final RestClient restClient;
    private final TarballExtractor extractor;

    public HttpTarballFetcher(RestClient restClient, TarballExtractor extractor) {
        this.restClient = restClient;
        this.extractor = extractor;
    }

    @Override
    public void fetchAndExtract(String tarballUrl, String expectedShasum, Path destination) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent == null) {
            throw new IllegalArgumentException("目标目录无效：" + destination);
        }
        Files.createDirectories(parent);
        String prefix = destination.getFileName().toString();

        Path tarball = Files.createTempFile(parent, prefix + "-", ".tgz");
        Path staging = null;
        try {
            download(tarballUrl, tarball);
            if (expectedShasum != null && !expectedShasum.isBlank()) {
                String actual = HashingUtils.sha1Hex(tarball);
                if (!actual.equals(expectedShasum.toLowerCase(Locale.ROOT))) {
                    throw new IOException("tarball sha1 校验失败：" + tarballUrl + "（期望 " + expectedShasum + "，实际 " + actual + "）");
                }
            }

            staging = Files.createTempDirectory(parent, prefix + ".tmp-");
            int files = extractor.extract(tarball, staging);
            if (publish(staging, destination)) {
                staging = null;
                log.info("已解包 {} 个文件到 {}", files, destination);
            }
        } finally {
            deleteQuietly(tarball);
            if (staging != null) {
                deleteQuietly(staging);
            }
        }
    }

    private void download(String tarballUrl, Path target) throws IOException {
        URI uri = URI.create(tarballUrl);
        outboundRequestLog.info("Tarball GET {}", uri);
        HttpStatusCode status;
        try {
            status = restClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_OCTET_STREAM)
                    .exchange((request, response) -> {
                        if (response.getStatusCode().is2xxSuccessful()) {
                            try (InputStream body = response.getBody()) {
                                Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                            }
                        }
                        return response.getStatusCode();
                    });
        } catch (RestClientException e) {
            throw new IOException("下载 tarball 失败：" + tarballUrl, e);
        }
        outboundRequestLog.info("Tarball GET {} - {}", uri, status.value());
        if (!status.is2xxSuccessful()) {
            throw new IOException("下载 tarball 返回非预期状态码 " + status.value() + "：" + tarballUrl);
        }
    }

    /**
     * @return true 表示本次发布成功；false 表示其他请求已经发布了同一目录
     */
    private static boolean publish(Path staging, Path destination) throws IOException {
        try {
            Files.move(staging, destination, StandardCopyOption.ATOMIC_MOVE);
            return true;
        } catch (FileSystemException e) {
            if (Files.isRegularFile(destination.resolve(PackageCache.MANIFEST_FILE))) {
                log.info("{} 已被其他请求发布，丢弃本次解包结果", destination);
                return false;
            }
            throw e;
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            FileSystemUtils.deleteRecursively(path);
        } catch (IOException e) {
            log.warn("清理临时文件失败：{}（{}）", path, e.getMessage());
        }
    }
}
