package org.pkgcdn.web;

import org.pkgcdn.cdn.CdnResponse;
import org.pkgcdn.cdn.MimeTypes;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

/**
 * 把 {@link CdnResponse} 转换为 Spring MVC 的 {@link ResponseEntity}。
 * <p>
 * 缓存时长大于 0 时下发 {@code Cache-Control: max-age=N, public}，等于 0 时不下发。
 */
final class CdnResponses {

    static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private CdnResponses() {
    }

    static ResponseEntity<?> toResponseEntity(CdnResponse response) {
        return switch (response.kind()) {
            case FILE -> sendFile(response.file(), response.cacheTtl());
            case REDIRECT -> sendRedirect(response.location(), response.cacheTtl());
            case JSON -> sendJson(response.body(), response.cacheTtl());
            case TEXT -> sendText(response.status(), String.valueOf(response.body()));
        };
    }

    static ResponseEntity<FileSystemResource> sendFile(Path file, Duration cacheTtl) {
        return ResponseEntity.ok()
                .headers(cacheHeaders(cacheTtl))
                .contentType(MediaType.parseMediaType(MimeTypes.getContentType(file.getFileName().toString())))
                .body(new FileSystemResource(file));
    }

    static ResponseEntity<Void> sendRedirect(String location, Duration cacheTtl) {
        HttpHeaders headers = cacheHeaders(cacheTtl);
        headers.set(HttpHeaders.LOCATION, location);
        return ResponseEntity.status(302).headers(headers).build();
    }

    static ResponseEntity<Object> sendJson(Object body, Duration cacheTtl) {
        return ResponseEntity.ok()
                .headers(cacheHeaders(cacheTtl))
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }

    static ResponseEntity<String> sendText(int status, String message) {
        return ResponseEntity.status(status)
                .contentType(TEXT_PLAIN_UTF8)
                .body(message);
    }

    private static HttpHeaders cacheHeaders(Duration cacheTtl) {
        HttpHeaders headers = new HttpHeaders();
        if (cacheTtl != null && cacheTtl.getSeconds() > 0) {
            headers.setCacheControl(CacheControl.maxAge(cacheTtl).cachePublic());
        }
        return headers;
    }
}
