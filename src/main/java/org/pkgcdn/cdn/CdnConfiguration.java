package org.pkgcdn.cdn;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.pkgcdn.registry.RegistryClient;
import org.pkgcdn.registry.TarballFetcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 包 CDN 核心组件的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>缓存根目录由 {@link CdnProperties#resolveCacheRoot()} 决定，启动时创建；测试可以指向独立的临时目录。</li>
 *   <li>目录树的并发 stat 使用独立线程池，不占用 Web 请求线程。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class CdnConfiguration {

    @Bean
    public PackageCache packageCache(CdnProperties properties) throws IOException {
        PackageCache cache = new PackageCache(properties.resolveCacheRoot());
        cache.initialize();
        return cache;
    }

    @Bean
    public FileResolver fileResolver() {
        return new FileResolver();
    }

    @Bean
    public VersionResolver versionResolver() {
        return new VersionResolver();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService treeStatExecutor(CdnProperties properties) {
        return Executors.newFixedThreadPool(properties.getTreeStatThreads(), new CustomizableThreadFactory("tree-stat-"));
    }

    @Bean
    public DirectoryTreeBuilder directoryTreeBuilder(ExecutorService treeStatExecutor) {
        return new DirectoryTreeBuilder(treeStatExecutor);
    }

    @Bean
    public PackageBundler packageBundler() {
        return new NoBundlePackageBundler();
    }

    @Bean
    public PackageRequestHandler packageRequestHandler(
            CdnProperties properties,
            PackageCache packageCache,
            RegistryClient registryClient,
            TarballFetcher tarballFetcher,
            VersionResolver versionResolver,
            FileResolver fileResolver,
            DirectoryTreeBuilder directoryTreeBuilder,
            PackageBundler packageBundler,
            ObjectMapper objectMapper
    ) {
        return new PackageRequestHandler(
                properties,
                packageCache,
                registryClient,
                tarballFetcher,
                versionResolver,
                fileResolver,
                directoryTreeBuilder,
                packageBundler,
                objectMapper
        );
    }
}
