package org.pkgcdn.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.pkgcdn.cdn.CdnProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * 注册中心与 tarball 下载相关的 Bean 装配。超时只在这里配置，处理流程本身不做超时控制。
 */
@Configuration(proxyBeanMethods = false)
public class RegistryConfiguration {

    @Bean
    public RestClient registryRestClient(RestClient.Builder builder, CdnProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getRegistryConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getRegistryReadTimeout().toMillis());
        return builder.requestFactory(requestFactory).build();
    }

    @Bean
    public RegistryClient registryClient(RestClient registryRestClient, CdnProperties properties, ObjectMapper objectMapper) {
        return new HttpRegistryClient(registryRestClient, properties.getRegistryUrl(), objectMapper);
    }

    @Bean
    public TarballExtractor tarballExtractor() {
        return new TarballExtractor();
    }

    @Bean
    public TarballFetcher tarballFetcher(RestClient registryRestClient, TarballExtractor tarballExtractor) {
        return new HttpTarballFetcher(registryRestClient, tarballExtractor);
    }
}
