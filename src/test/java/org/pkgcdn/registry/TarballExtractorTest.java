package org.pkgcdn.registry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TarballExtractorTest {

    @TempDir
    Path dir;

    private final TarballExtractor extractor = new TarballExtractor();

    @Test
    void extract_stripsLeadingPackageDirectory() throws IOException {
        Path tarball = write(TarballFixtures.builder()
                .directory("package/lib")
                .file("package/package.json", "{\"name\":\"demo\"}")
                .file("package/lib/index.js", "module.exports = 1;")
                .build());
        Path destination = dir.resolve("demo-1.0.0");

        int files = extractor.extract(tarball, destination);

        assertThat(files).isEqualTo(2);
        assertThat(destination.resolve("package.json")).hasContent("{\"name\":\"demo\"}");
        assertThat(destination.resolve("lib/index.js")).hasContent("module.exports = 1;");
        assertThat(destination.resolve("package")).doesNotExist();
    }

    @Test
    void extract_handlesOddTopLevelDirectoryNames() throws IOException {
        Path tarball = write(TarballFixtures.builder()
                .file("node-demo-1.0.0/package.json", "{}")
                .build());
        Path destination = dir.resolve("out");

        extractor.extract(tarball, destination);

        assertThat(destination.resolve("package.json")).exists();
    }

    @Test
    void extract_skipsSymlinks() throws IOException {
        Path tarball = write(TarballFixtures.builder()
                .file("package/package.json", "{}")
                .symlink("package/passwd", "/etc/passwd")
                .build());
        Path destination = dir.resolve("out");

        int files = extractor.extract(tarball, destination);

        assertThat(files).isEqualTo(1);
        assertThat(Files.exists(destination.resolve("passwd"), LinkOption.NOFOLLOW_LINKS)).isFalse();
    }

    @Test
    void extract_rejectsEntriesEscapingDestination() throws IOException {
        Path tarball = write(TarballFixtures.builder()
                .file("package/../../evil.js", "evil")
                .build());
        Path destination = dir.resolve("out");

        assertThatThrownBy(() -> extractor.extract(tarball, destination))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("evil.js");
        assertThat(dir.resolve("evil.js")).doesNotExist();
    }

    @Test
    void stripFirstComponent_removesOnlyTheFirstSegment() {
        assertThat(TarballExtractor.stripFirstComponent("package/lib/a.js")).isEqualTo("lib/a.js");
        assertThat(TarballExtractor.stripFirstComponent("./package/a.js")).isEqualTo("a.js");
        assertThat(TarballExtractor.stripFirstComponent("package/")).isEmpty();
        assertThat(TarballExtractor.stripFirstComponent("a.js")).isEqualTo("a.js");
    }

    private Path write(byte[] bytes) throws IOException {
        Path tarball = dir.resolve("demo.tgz");
        Files.write(tarball, bytes);
        return tarball;
    }
}
