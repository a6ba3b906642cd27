package org.pkgcdn.registry;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 把 .tgz 包解到目标目录。
 * <p>
 * 规则：
 * <ul>
 *   <li>去掉每个条目的第一级目录（包里通常是 {@code package/}）。</li>
 *   <li>只解出普通文件和目录；符号链接、硬链接、设备文件等一律跳过。</li>
 *   <li>条目路径逃逸出目标目录时整个解包失败。</li>
 * </ul>
 */
public class TarballExtractor {

    /**
     * @return 解出的普通文件数量
     */
    public int extract(Path tarball, Path destination) throws IOException {
        Path root = destination.toAbsolutePath().normalize();
        Files.createDirectories(root);

        int files = 0;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(tarball));
             GzipCompressorInputStream gzip = new GzipCompressorInputStream(in);
             TarArchiveInputStream tar = new TarArchiveInputStream(gzip)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                String name = stripFirstComponent(entry.getName());
                if (name.isEmpty() || isSpecial(entry)) {
                    continue;
                }
                Path target = root.resolve(name).normalize();
                if (!target.startsWith(root) || target.equals(root)) {
                    throw new IOException("tarball 条目路径不在目标目录范围内：" + entry.getName());
                }

                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else if (entry.isFile()) {
                    Files.createDirectories(target.getParent());
                    Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
                    files++;
                }
            }
        }
        return files;
    }

    private static boolean isSpecial(TarArchiveEntry entry) {
        return entry.isSymbolicLink() || entry.isLink() || entry.isCharacterDevice()
                || entry.isBlockDevice() || entry.isFIFO();
    }

    /**
     * {@code package/lib/a.js} -> {@code lib/a.js}；没有目录前缀的条目原样返回。
     */
    static String stripFirstComponent(String entryName) {
        String name = entryName.replace('\\', '/');
        while (name.startsWith("./")) {
            name = name.substring(2);
        }
        int slash = name.indexOf('/');
        if (slash < 0) {
            return name;
        }
        return name.substring(slash + 1);
    }
}
