package org.pkgcdn.cdn;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;

/**
 * 按 require() 的习惯解析文件：{@code lib/file} 依次尝试 {@code lib/file}、{@code lib/file.js}、{@code lib/file.json}。
 * <p>
 * 规则：
 * <ul>
 *   <li>第一个存在的普通文件胜出；目录不算命中。</li>
 *   <li>{@code useIndex=true} 且候选是目录时，进入 {@code 目录/index} 再解析一次（此时不再允许继续找 index）。</li>
 *   <li>“不存在”以外的 IO 错误直接抛出，不当作未找到。</li>
 * </ul>
 */
public class FileResolver {

    private static final List<String> RESOLVE_EXTENSIONS = List.of("", ".js", ".json");

    /**
     * @return 命中的文件；都不存在时为 null
     */
    public Path resolve(Path file, boolean useIndex) throws IOException {
        for (String extension : RESOLVE_EXTENSIONS) {
            Path candidate = file.resolveSibling(file.getFileName() + extension);
            BasicFileAttributes attrs = statIfExists(candidate);
            if (attrs == null) {
                continue;
            }
            if (attrs.isRegularFile()) {
                return candidate;
            }
            if (useIndex && attrs.isDirectory()) {
                Path indexFile = resolve(candidate.resolve("index"), false);
                if (indexFile != null) {
                    return indexFile;
                }
            }
        }
        return null;
    }

    /**
     * stat（跟随符号链接）；路径不存在时返回 null。
     */
    static BasicFileAttributes statIfExists(Path path) throws IOException {
        try {
            return Files.readAttributes(path, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return null;
        }
    }
}
