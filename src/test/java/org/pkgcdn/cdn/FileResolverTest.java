package org.pkgcdn.cdn;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileResolverTest {

    @TempDir
    Path dir;

    private final FileResolver resolver = new FileResolver();

    @Test
    void resolve_prefersLiteralFile() throws IOException {
        write("lib/foo");
        write("lib/foo.js");

        assertThat(resolver.resolve(dir.resolve("lib/foo"), false)).isEqualTo(dir.resolve("lib/foo"));
    }

    @Test
    void resolve_prefersJsOverJson() throws IOException {
        write("lib/foo.js");
        write("lib/foo.json");

        assertThat(resolver.resolve(dir.resolve("lib/foo"), false)).isEqualTo(dir.resolve("lib/foo.js"));
    }

    @Test
    void resolve_fallsBackToJson() throws IOException {
        write("lib/foo.json");

        assertThat(resolver.resolve(dir.resolve("lib/foo"), false)).isEqualTo(dir.resolve("lib/foo.json"));
    }

    @Test
    void resolve_returnsNullWhenNothingExists() throws IOException {
        assertThat(resolver.resolve(dir.resolve("missing"), true)).isNull();
        assertThat(resolver.resolve(dir.resolve("missing/deeper"), true)).isNull();
    }

    @Test
    void resolve_directoryIsNotAFileWithoutIndexFallback() throws IOException {
        write("lib/index.js");

        assertThat(resolver.resolve(dir.resolve("lib"), false)).isNull();
    }

    @Test
    void resolve_usesIndexOfDirectoryWhenAllowed() throws IOException {
        write("lib/index.json");

        assertThat(resolver.resolve(dir.resolve("lib"), true)).isEqualTo(dir.resolve("lib/index.json"));
    }

    @Test
    void resolve_indexFallbackDoesNotRecurseIntoIndexDirectory() throws IOException {
        // lib/index 是目录，里面的 index.js 不应该被找到
        write("lib/index/index.js");

        assertThat(resolver.resolve(dir.resolve("lib"), true)).isNull();
    }

    @Test
    void resolve_directoryWithoutIndexContinuesWithExtensions() throws IOException {
        Files.createDirectories(dir.resolve("lib"));
        write("lib.js");

        assertThat(resolver.resolve(dir.resolve("lib"), true)).isEqualTo(dir.resolve("lib.js"));
    }

    @Test
    void resolve_propagatesErrorsOtherThanMissingFile() throws IOException {
        // lib/foo 是普通文件，lib/foo/bar 的 stat 得到 ENOTDIR 而不是“不存在”
        write("lib/foo");

        assertThatThrownBy(() -> resolver.resolve(dir.resolve("lib/foo/bar"), true))
                .isInstanceOf(FileSystemException.class)
                .isNotInstanceOf(NoSuchFileException.class);
    }

    private void write(String relative) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, relative);
    }
}
