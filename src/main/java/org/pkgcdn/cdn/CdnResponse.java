package org.pkgcdn.cdn;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 一次请求的处理结果，由 web 层转换成具体的 HTTP 响应。
 *
 * @param kind     响应类型
 * @param status   HTTP 状态码
 * @param file     {@link Kind#FILE} 时要发送的文件
 * @param location {@link Kind#REDIRECT} 时的目标地址
 * @param body     {@link Kind#JSON} 时的对象，{@link Kind#TEXT} 时的文本
 * @param cacheTtl 缓存时长；{@link Duration#ZERO} 表示不下发缓存指令
 */
public record CdnResponse(
        Kind kind,
        int status,
        Path file,
        String location,
        Object body,
        Duration cacheTtl
) {

    public static CdnResponse file(Path file, Duration cacheTtl) {
        return new CdnResponse(Kind.FILE, 200, file, null, null, cacheTtl);
    }

    public static CdnResponse redirect(String location, Duration cacheTtl) {
        return new CdnResponse(Kind.REDIRECT, 302, null, location, null, cacheTtl);
    }

    public static CdnResponse json(Object body, Duration cacheTtl) {
        return new CdnResponse(Kind.JSON, 200, null, null, body, cacheTtl);
    }

    public static CdnResponse text(int status, String message) {
        return new CdnResponse(Kind.TEXT, status, null, null, message, Duration.ZERO);
    }

    public enum Kind {
        FILE,
        REDIRECT,
        JSON,
        TEXT
    }
}
