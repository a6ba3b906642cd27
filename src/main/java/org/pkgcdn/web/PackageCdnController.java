package org.pkgcdn.web;

import jakarta.servlet.http.HttpServletRequest;
import org.pkgcdn.cdn.CdnResponse;
import org.pkgcdn.cdn.InvalidPackageUrlException;
import org.pkgcdn.cdn.PackageRequestHandler;
import org.pkgcdn.cdn.PackageUrlParser;
import org.pkgcdn.cdn.dto.PackageRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

/**
 * 包 CDN 的 HTTP 入口。
 * <p>
 * 支持的 URL（挂载前缀即 servlet context path，重定向时保留）：
 * <ul>
 *   <li>{@code /history@1.12.5/umd/History.min.js}（推荐）</li>
 *   <li>{@code /history@1.12.5}（输出 package.json 的 main）</li>
 *   <li>{@code /history}、{@code /history@latest/...}、{@code /history@^1/...}（302 到精确版本）</li>
 * </ul>
 */
@RestController
public class PackageCdnController {

    private static final Logger log = LoggerFactory.getLogger(PackageCdnController.class);

    private final PackageRequestHandler requestHandler;

    public PackageCdnController(PackageRequestHandler requestHandler) {
        this.requestHandler = requestHandler;
    }

    @GetMapping("/**")
    public ResponseEntity<?> get(
            HttpServletRequest request,
            @RequestParam(name = "main", required = false) String main
    ) throws IOException {
        String baseUrl = request.getContextPath();
        String path = request.getRequestURI().substring(baseUrl.length());

        PackageRequest packageRequest = PackageUrlParser.parse(path, request.getQueryString());
        log.debug("{} {} -> {}", baseUrl, path, packageRequest);
        if (packageRequest == null) {
            throw new InvalidPackageUrlException(path);
        }

        CdnResponse response = requestHandler.handle(packageRequest, baseUrl, main);
        return CdnResponses.toResponseEntity(response);
    }
}
