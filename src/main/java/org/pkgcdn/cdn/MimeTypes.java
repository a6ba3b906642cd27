package org.pkgcdn.cdn;

import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 按文件名推断 Content-Type。
 * <p>
 * 先查 Spring 自带的 mime.types；包里常见的无扩展名文本（LICENSE、README 等）和源码类扩展名按 text/plain 返回，
 * 其余未知类型一律 application/octet-stream。
 */
public final class MimeTypes {

    static final String DEFAULT_TYPE = MediaType.APPLICATION_OCTET_STREAM_VALUE;

    private static final Pattern TEXT_FILES =
            Pattern.compile("(^|/)(license|licence|readme|changes|changelog|authors|contributors|makefile|history|notice)(\\.(md|markdown|txt))?$");

    private static final Pattern TEXT_EXTENSIONS =
            Pattern.compile("\\.(md|markdown|flow|ts|tsx|mts|cts|txt|yml|yaml|lock|coffee|jsx|vue|svelte)$");

    private MimeTypes() {
    }

    public static String getContentType(String filename) {
        if (filename == null || filename.isEmpty()) {
            return DEFAULT_TYPE;
        }
        String name = filename.toLowerCase(Locale.ROOT);
        if (name.endsWith(".mjs") || name.endsWith(".cjs")) {
            return "application/javascript";
        }
        if (TEXT_FILES.matcher(name).find() || TEXT_EXTENSIONS.matcher(name).find()) {
            return MediaType.TEXT_PLAIN_VALUE;
        }
        return MediaTypeFactory.getMediaType(name)
                .map(MediaType::toString)
                .orElse(DEFAULT_TYPE);
    }
}
