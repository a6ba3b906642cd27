package org.pkgcdn.cdn;

import org.pkgcdn.cdn.dto.EntryType;
import org.pkgcdn.cdn.dto.FileSystemEntry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 目录树生成器：递归遍历已解包的包目录，生成可序列化为 JSON 的 {@link FileSystemEntry} 树。
 * <p>
 * 遍历方式：
 * <ul>
 *   <li>同一层的子项并发 stat（在 {@link #executor} 上执行），父目录等待所有子树完成后才完成。</li>
 *   <li>子项顺序与目录列举顺序一致，不做排序。</li>
 *   <li>深度用尽的目录 {@code children=null}，与“空目录”（空列表）区分。</li>
 *   <li>任意一个子项 stat 失败（例如遍历途中被删除），整棵树构建失败，不返回残缺结果。</li>
 *   <li>使用 lstat 语义：符号链接按 symlink 报告，不跟随。</li>
 * </ul>
 */
public class DirectoryTreeBuilder {

    private static final int S_IFMT = 0170000;
    private static final int S_IFSOCK = 0140000;
    private static final int S_IFBLK = 0060000;
    private static final int S_IFCHR = 0020000;
    private static final int S_IFIFO = 0010000;

    private final Executor executor;

    public DirectoryTreeBuilder(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * 阻塞版本：等待整棵树构建完成。
     *
     * @param baseDir      包根目录
     * @param relativePath 相对包根目录的路径（例如 {@code /lib/}）
     * @param maxDepth     最大展开深度
     */
    public FileSystemEntry build(Path baseDir, String relativePath, int maxDepth) throws IOException {
        try {
            return buildAsync(baseDir, relativePath, maxDepth).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("生成目录树失败：" + relativePath, cause);
        }
    }

    public CompletableFuture<FileSystemEntry> buildAsync(Path baseDir, String relativePath, int maxDepth) {
        String path;
        try {
            path = normalizeEntryPath(baseDir, relativePath);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return stat(baseDir, path)
                .thenCompose(stat -> resolveEntry(baseDir, path, stat, maxDepth));
    }

    private CompletableFuture<FileSystemEntry> resolveEntry(Path baseDir, String path, Stat stat, int maxDepth) {
        if (stat.type() != EntryType.DIRECTORY) {
            return CompletableFuture.completedFuture(toEntry(path, stat, null));
        }
        CompletableFuture<List<FileSystemEntry>> children = maxDepth > 0
                ? listChildren(baseDir, path, maxDepth - 1)
                : CompletableFuture.completedFuture(null);
        return children.thenApply(list -> toEntry(path, stat, list));
    }

    private CompletableFuture<List<FileSystemEntry>> listChildren(Path baseDir, String path, int childDepth) {
        return schedule(() -> listNames(locate(baseDir, path)), executor)
                .thenCompose(names -> {
                    List<CompletableFuture<FileSystemEntry>> futures = new ArrayList<>(names.size());
                    for (String name : names) {
                        String childPath = childPath(path, name);
                        futures.add(stat(baseDir, childPath)
                                .thenCompose(stat -> resolveEntry(baseDir, childPath, stat, childDepth)));
                    }
                    return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                            .thenApply(ignored -> {
                                List<FileSystemEntry> entries = new ArrayList<>(futures.size());
                                for (CompletableFuture<FileSystemEntry> future : futures) {
                                    entries.add(future.join());
                                }
                                return entries;
                            });
                });
    }

    private CompletableFuture<Stat> stat(Path baseDir, String path) {
        return schedule(() -> {
            Path file = locate(baseDir, path);
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            return new Stat(attrs, classify(file, attrs));
        }, executor);
    }

    private static List<String> listNames(Path dir) throws IOException {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                names.add(child.getFileName().toString());
            }
        }
        return names;
    }

    private static FileSystemEntry toEntry(String path, Stat stat, List<FileSystemEntry> children) {
        BasicFileAttributes attrs = stat.attrs();
        return new FileSystemEntry(
                path,
                attrs.lastModifiedTime().toInstant(),
                MimeTypes.getContentType(path),
                attrs.size(),
                stat.type(),
                children
        );
    }

    static EntryType classify(Path file, BasicFileAttributes attrs) throws IOException {
        if (attrs.isRegularFile()) {
            return EntryType.FILE;
        }
        if (attrs.isDirectory()) {
            return EntryType.DIRECTORY;
        }
        if (attrs.isSymbolicLink()) {
            return EntryType.SYMLINK;
        }
        if (!attrs.isOther()) {
            return EntryType.UNKNOWN;
        }

        // 设备/管道/套接字只能通过 unix:mode 区分；没有 unix 视图的平台统一报 unknown
        Object mode;
        try {
            mode = Files.getAttribute(file, "unix:mode", LinkOption.NOFOLLOW_LINKS);
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            return EntryType.UNKNOWN;
        }
        if (!(mode instanceof Integer bits)) {
            return EntryType.UNKNOWN;
        }
        return switch (bits & S_IFMT) {
            case S_IFSOCK -> EntryType.SOCKET;
            case S_IFBLK -> EntryType.BLOCK_DEVICE;
            case S_IFCHR -> EntryType.CHARACTER_DEVICE;
            case S_IFIFO -> EntryType.FIFO;
            default -> EntryType.UNKNOWN;
        };
    }

    private static Path locate(Path baseDir, String path) {
        Path file = baseDir.resolve(path.substring(1)).normalize();
        if (!file.startsWith(baseDir.normalize())) {
            throw new IllegalArgumentException("路径不在包目录范围内：" + path);
        }
        return file;
    }

    /**
     * 统一为以 / 开头、不带结尾 / 的形式（根目录为 {@code /}）；{@code .}、{@code ..} 按包目录解析后去掉。
     *
     * @throws IllegalArgumentException 路径逃逸出包目录
     */
    static String normalizeEntryPath(Path baseDir, String relativePath) {
        String path = (relativePath == null) ? "" : relativePath.replace('\\', '/');
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        Path base = baseDir.normalize();
        Path target = base.resolve(path).normalize();
        if (!target.startsWith(base)) {
            throw new IllegalArgumentException("路径不在包目录范围内：" + relativePath);
        }
        String relative = base.relativize(target).toString().replace('\\', '/');
        return relative.isEmpty() ? "/" : "/" + relative;
    }

    private static String childPath(String parent, String name) {
        return "/".equals(parent) ? "/" + name : parent + "/" + name;
    }

    private static <T> CompletableFuture<T> schedule(Callable<T> source, Executor executor) {
        CompletableFuture<T> cf = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                cf.complete(source.call());
            } catch (IOException e) {
                cf.completeExceptionally(new UncheckedIOException(e));
            } catch (Throwable t) {
                cf.completeExceptionally(t);
            }
        });
        return cf;
    }

    private record Stat(BasicFileAttributes attrs, EntryType type) {
    }
}
