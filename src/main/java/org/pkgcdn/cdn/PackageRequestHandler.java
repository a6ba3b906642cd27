package org.pkgcdn.cdn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.pkgcdn.cdn.dto.FileSystemEntry;
import org.pkgcdn.cdn.dto.PackageInfo;
import org.pkgcdn.cdn.dto.PackageRequest;
import org.pkgcdn.cdn.dto.ResolvedPackage;
import org.pkgcdn.registry.RegistryClient;
import org.pkgcdn.registry.RegistryException;
import org.pkgcdn.registry.TarballFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 包请求的处理流程：缓存检查 -> （未命中时）查询注册中心 -> 下载解包 / 重定向 -> 输出文件、目录列表或入口文件。
 * <p>
 * 版本处理：
 * <ul>
 *   <li>精确版本：未缓存时同步下载解包（请求一直等到解包完成或失败），然后直接输出。</li>
 *   <li>dist-tag / semver range：解析为精确版本后 302 到规范 URL，缓存时长为 {@code app.cdn.redirect-ttl}。</li>
 *   <li>缓存目录只按精确版本划分，tag/range 永远不会直接命中缓存。</li>
 * </ul>
 * 文件处理：
 * <ul>
 *   <li>带文件名：按 {@link FileResolver} 解析（不找 index）；解析不到且是目录时，自动补 / 重定向或输出 JSON 目录树。</li>
 *   <li>不带文件名：读取 package.json 的 main（可用 {@code ?main=字段名} 覆盖），按 {@link FileResolver} 解析（允许找 index）。</li>
 * </ul>
 * 注册中心访问和下载都不重试，失败直接报告给调用方。
 */
public class PackageRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(PackageRequestHandler.class);

    static final String DEFAULT_MAIN_FIELD = "main";
    static final String DEFAULT_MAIN_FILE = "index";

    private final CdnProperties properties;
    private final PackageCache cache;
    private final RegistryClient registryClient;
    private final TarballFetcher tarballFetcher;
    private final VersionResolver versionResolver;
    private final FileResolver fileResolver;
    private final DirectoryTreeBuilder treeBuilder;
    private final PackageBundler bundler;
    private final ObjectMapper objectMapper;

    public PackageRequestHandler(
            CdnProperties properties,
            PackageCache cache,
            RegistryClient registryClient,
            TarballFetcher tarballFetcher,
            VersionResolver versionResolver,
            FileResolver fileResolver,
            DirectoryTreeBuilder treeBuilder,
            PackageBundler bundler,
            ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.cache = cache;
        this.registryClient = registryClient;
        this.tarballFetcher = tarballFetcher;
        this.versionResolver = versionResolver;
        this.fileResolver = fileResolver;
        this.treeBuilder = treeBuilder;
        this.bundler = bundler;
        this.objectMapper = objectMapper;
    }

    /**
     * @param request   解析后的请求
     * @param baseUrl   挂载前缀（重定向时原样保留）
     * @param mainField {@code ?main=} 指定的入口字段；未指定为 null
     * @throws PackageNotFoundException 包、版本、字段或文件不存在
     * @throws InvalidPackageUrlException 包名/版本无法映射到缓存目录
     * @throws RegistryException        注册中心访问失败
     * @throws IOException              下载解包或读取本地文件失败
     */
    public CdnResponse handle(PackageRequest request, String baseUrl, String mainField) throws IOException {
        String packageName = request.packageName();
        String versionToken = request.versionToken();

        // 最好的情况：精确版本已经在本地
        if (VersionResolver.isExactVersion(versionToken)) {
            ResolvedPackage cached = resolve(request, versionToken);
            if (cache.isCached(cached.cacheDirectory())) {
                return serve(cached, request, baseUrl, mainField);
            }
        }

        PackageInfo info = registryClient.getPackageInfo(packageName);
        if (info == null) {
            throw new PackageNotFoundException("package \"" + packageName + "\"");
        }

        VersionResolver.Resolution resolution = versionResolver.resolve(info, versionToken);
        if (resolution == null) {
            throw new PackageNotFoundException("package " + packageName + "@" + versionToken);
        }

        if (resolution.needsRedirect()) {
            String location = baseUrl + packageUrl(packageName, resolution.version(), request.filename()) + request.search();
            log.debug("{} -> {}（{}）", request.displayName(), resolution.version(), resolution.kind());
            return CdnResponse.redirect(location, properties.getRedirectTtl());
        }

        ResolvedPackage resolved = resolve(request, resolution.version());
        if (!cache.isCached(resolved.cacheDirectory())) {
            String tarballUrl = info.tarballUrl(resolution.version());
            if (tarballUrl == null) {
                throw new RegistryException("Unable to find tarball for package " + resolved.displayName());
            }
            tarballFetcher.fetchAndExtract(tarballUrl, info.shasum(resolution.version()), resolved.cacheDirectory());
        }
        return serve(resolved, request, baseUrl, mainField);
    }

    private CdnResponse serve(ResolvedPackage pkg, PackageRequest request, String baseUrl, String mainField) throws IOException {
        String filename = request.filename();
        if (filename.equals(properties.getBundlePath())) {
            return serveBundle(pkg, filename);
        }
        if (request.hasFilename()) {
            return serveFilename(pkg, request, baseUrl);
        }
        return serveMain(pkg, mainField);
    }

    private CdnResponse serveBundle(ResolvedPackage pkg, String filename) throws IOException {
        Path bundle = bundler.createBundle(pkg);
        if (bundle == null) {
            throw new PackageNotFoundException(filename.substring(1) + " in package " + pkg.displayName());
        }
        return CdnResponse.file(bundle, properties.getFileTtl());
    }

    private CdnResponse serveFilename(ResolvedPackage pkg, PackageRequest request, String baseUrl) throws IOException {
        String filename = request.filename();
        Path packageDir = pkg.cacheDirectory();
        Path target = cache.resolveInside(packageDir, filename);
        if (target == null) {
            throw fileNotFound(filename, pkg);
        }

        // 尽量输出 URL 中的文件；找不到时再看是不是目录。以 / 结尾的 URL 只可能是目录
        boolean directoryUrl = filename.endsWith("/") || target.equals(packageDir);
        Path file = directoryUrl ? null : fileResolver.resolve(target, false);
        if (file != null) {
            return CdnResponse.file(file, properties.getFileTtl());
        }

        if (properties.isAutoIndex() && Files.isDirectory(target)) {
            // 目录 URL 统一以 / 结尾
            if (!filename.endsWith("/")) {
                String location = baseUrl + packageUrl(pkg.packageName(), pkg.exactVersion(), filename + "/") + request.search();
                return CdnResponse.redirect(location, properties.getRedirectTtl());
            }
            FileSystemEntry tree = treeBuilder.build(packageDir, filename, properties.getMaximumDepth());
            return CdnResponse.json(tree, properties.getFileTtl());
        }

        throw fileNotFound(filename, pkg);
    }

    private CdnResponse serveMain(ResolvedPackage pkg, String mainField) throws IOException {
        Path packageDir = pkg.cacheDirectory();
        String data = Files.readString(packageDir.resolve(PackageCache.MANIFEST_FILE), StandardCharsets.UTF_8);

        JsonNode packageConfig;
        try {
            packageConfig = objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            log.warn("解析 {} 的 package.json 失败：{}", pkg.displayName(), e.getOriginalMessage());
            return CdnResponse.text(500, "Error parsing package.json: " + e.getOriginalMessage());
        }

        boolean hasOverride = mainField != null && !mainField.isEmpty();
        if (hasOverride && !packageConfig.has(mainField)) {
            throw new PackageNotFoundException("field \"" + mainField + "\" in package.json of " + pkg.displayName());
        }

        // 与 npm 一致：没有 main 时默认 index
        String mainProperty = hasOverride ? mainField : DEFAULT_MAIN_FIELD;
        JsonNode mainValue = packageConfig.path(mainProperty);
        String mainFilename = (mainValue.isTextual() && !mainValue.asText().isEmpty()) ? mainValue.asText() : DEFAULT_MAIN_FILE;

        Path target = cache.resolveInside(packageDir, mainFilename);
        if (target != null && target.equals(packageDir)) {
            target = packageDir.resolve(DEFAULT_MAIN_FILE);
        }
        Path file = (target == null) ? null : fileResolver.resolve(target, true);
        if (file == null) {
            throw new PackageNotFoundException("main file \"" + mainFilename + "\" in package " + pkg.displayName());
        }
        return CdnResponse.file(file, properties.getFileTtl());
    }

    private ResolvedPackage resolve(PackageRequest request, String exactVersion) {
        try {
            return cache.resolved(request.packageName(), exactVersion);
        } catch (IllegalArgumentException e) {
            throw new InvalidPackageUrlException(request.toUrl(exactVersion));
        }
    }

    private static PackageNotFoundException fileNotFound(String filename, ResolvedPackage pkg) {
        return new PackageNotFoundException("file \"" + filename + "\" in package " + pkg.displayName());
    }

    /**
     * 重定向地址的路径部分；filename 是解码后的值，这里重新编码。
     */
    private static String packageUrl(String packageName, String version, String filename) {
        return UriUtils.encodePath(PackageRequest.createUrl(packageName, version, filename, null), StandardCharsets.UTF_8);
    }
}
