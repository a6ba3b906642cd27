package org.pkgcdn.cdn;

import org.pkgcdn.cdn.dto.ResolvedPackage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * 本地包缓存：负责缓存目录的布局、受控拼接与“是否已缓存”的判断。
 * <p>
 * 约定：
 * <ul>
 *   <li>每个精确版本一个目录：{@code <root>/<packageName>-<version>}（scope 包落在 {@code @scope/} 子目录下）。</li>
 *   <li>目录内存在 {@code package.json} 普通文件即视为已缓存，没有额外的索引或 TTL。</li>
 *   <li>所有拼接结果都必须留在根目录（或包目录）之内，阻止 {@code ../} 逃逸。</li>
 * </ul>
 */
public class PackageCache {

    public static final String MANIFEST_FILE = "package.json";

    private final Path root;

    public PackageCache(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * 创建缓存根目录（启动时调用一次）。
     */
    public void initialize() throws IOException {
        Files.createDirectories(root);
    }

    /**
     * @throws IllegalArgumentException 包名/版本拼出的目录不在缓存根目录内
     */
    public Path directoryFor(String packageName, String version) {
        Path dir = root.resolve(packageName + "-" + version).normalize();
        if (!dir.startsWith(root) || dir.equals(root)) {
            throw new IllegalArgumentException("缓存目录不在根目录范围内：" + packageName + "@" + version);
        }
        return dir;
    }

    public ResolvedPackage resolved(String packageName, String exactVersion) {
        return new ResolvedPackage(packageName, exactVersion, directoryFor(packageName, exactVersion));
    }

    /**
     * 把包内路径拼接到包目录上（受控拼接）。
     *
     * @param filename 包内路径，例如 {@code /lib/index.js}
     * @return 规范化后的绝对路径；路径逃逸出包目录时为 null
     */
    public Path resolveInside(Path packageDir, String filename) {
        String relative = filename.startsWith("/") ? filename.substring(1) : filename;
        Path target;
        try {
            target = packageDir.resolve(relative).normalize();
        } catch (InvalidPathException e) {
            return null;
        }
        if (!target.startsWith(packageDir)) {
            return null;
        }
        return target;
    }

    /**
     * 包目录下存在 package.json 普通文件即视为已缓存。
     */
    public boolean isCached(Path packageDir) {
        return Files.isRegularFile(packageDir.resolve(MANIFEST_FILE));
    }
}
