package org.pkgcdn.web;

import org.pkgcdn.cdn.InvalidPackageUrlException;
import org.pkgcdn.cdn.PackageNotFoundException;
import org.pkgcdn.registry.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;

/**
 * 异常到响应的映射：
 * <ul>
 *   <li>URL 不合法：403，回显原始路径。</li>
 *   <li>包/版本/字段/文件不存在：404，说明具体缺的是什么。</li>
 *   <li>注册中心或本地文件系统失败：500，原因只写日志，响应体不暴露细节。</li>
 *   <li>其余未预期的运行时异常同样按 500 处理。</li>
 * </ul>
 */
@RestControllerAdvice
public class CdnExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CdnExceptionHandler.class);

    static final String SERVER_ERROR_MESSAGE = "Server error";

    @ExceptionHandler(InvalidPackageUrlException.class)
    public ResponseEntity<String> invalidUrl(InvalidPackageUrlException e) {
        return CdnResponses.sendText(403, "Invalid URL: " + e.getUrl());
    }

    @ExceptionHandler(PackageNotFoundException.class)
    public ResponseEntity<String> notFound(PackageNotFoundException e) {
        log.debug("404 {}", e.getSubject());
        return CdnResponses.sendText(404, "Not found: " + e.getSubject());
    }

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<String> upstreamError(RegistryException e) {
        log.error("注册中心访问失败", e);
        return CdnResponses.sendText(500, SERVER_ERROR_MESSAGE);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<String> filesystemError(IOException e) {
        log.error("读取/下载包文件失败", e);
        return CdnResponses.sendText(500, SERVER_ERROR_MESSAGE);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<String> unexpectedError(RuntimeException e) {
        log.error("处理请求时出现未预期的异常", e);
        return CdnResponses.sendText(500, SERVER_ERROR_MESSAGE);
    }
}
