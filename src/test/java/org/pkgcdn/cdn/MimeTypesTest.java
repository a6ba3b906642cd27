package org.pkgcdn.cdn;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MimeTypesTest {

    @Test
    void getContentType_usesRegisteredTypes() {
        assertThat(MimeTypes.getContentType("package.json")).isEqualTo("application/json");
        assertThat(MimeTypes.getContentType("dist/app.css")).isEqualTo("text/css");
        assertThat(MimeTypes.getContentType("logo.PNG")).isEqualTo("image/png");
    }

    @Test
    void getContentType_treatsWellKnownTextFilesAsPlainText() {
        assertThat(MimeTypes.getContentType("LICENSE")).isEqualTo("text/plain");
        assertThat(MimeTypes.getContentType("/README.md")).isEqualTo("text/plain");
        assertThat(MimeTypes.getContentType("docs/CHANGELOG")).isEqualTo("text/plain");
        assertThat(MimeTypes.getContentType("src/index.ts")).isEqualTo("text/plain");
        assertThat(MimeTypes.getContentType("yarn.lock")).isEqualTo("text/plain");
    }

    @Test
    void getContentType_doesNotTreatScriptsNamedLikeTextFilesAsText() {
        assertThat(MimeTypes.getContentType("lib/history.js")).isNotEqualTo("text/plain");
    }

    @Test
    void getContentType_mapsModuleScriptsToJavascript() {
        assertThat(MimeTypes.getContentType("index.mjs")).isEqualTo("application/javascript");
        assertThat(MimeTypes.getContentType("index.cjs")).isEqualTo("application/javascript");
    }

    @Test
    void getContentType_fallsBackToOctetStream() {
        assertThat(MimeTypes.getContentType("data.zzqq")).isEqualTo("application/octet-stream");
        assertThat(MimeTypes.getContentType("")).isEqualTo("application/octet-stream");
    }
}
