package org.pkgcdn.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.pkgcdn.cdn.dto.PackageInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.InputStream;
import java.net.URI;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 基于 Spring {@link RestClient} 的注册中心客户端：{@code GET {registryUrl}/{packageName}}。
 * <p>
 * 说明：
 * <ul>
 *   <li>scope 包名中的 / 编码为 {@code %2F}，与注册中心的约定一致。</li>
 *   <li>超时由构造时传入的 {@link RestClient} 决定；这里不做重试，失败直接抛 {@link RegistryException}。</li>
 * </ul>
 */
public class HttpRegistryClient implements RegistryClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRegistryClient.class);

    private final RestClient restClient;
    private final String registryUrl;
    private final ObjectMapper objectMapper;

    public HttpRegistryClient(RestClient restClient, String registryUrl, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.registryUrl = stripTrailingSlash(registryUrl);
        this.objectMapper = objectMapper;
    }

    @Override
    public PackageInfo getPackageInfo(String packageName) {
        URI uri = URI.create(registryUrl + "/" + encodePackageName(packageName));
        log.info("Registry GET {}", uri);

        RegistryResponse response;
        try {
            response = restClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .exchange((request, clientResponse) -> {
                        HttpStatusCode status = clientResponse.getStatusCode();
                        if (!status.is2xxSuccessful()) {
                            return new RegistryResponse(status, null);
                        }
                        try (InputStream body = clientResponse.getBody()) {
                            return new RegistryResponse(status, objectMapper.readTree(body));
                        }
                    });
        } catch (RestClientException e) {
            throw new RegistryException("访问注册中心失败：" + uri, e);
        }

        log.info("Registry GET {} - {}", uri, response.status().value());
        if (response.status().value() == HttpStatus.NOT_FOUND.value()) {
            return null;
        }
        if (!response.status().is2xxSuccessful()) {
            throw new RegistryException("注册中心返回非预期状态码 " + response.status().value() + "：" + uri);
        }
        return toPackageInfo(packageName, response.body());
    }

    static PackageInfo toPackageInfo(String packageName, JsonNode document) {
        if (document == null || !document.path("versions").isObject()) {
            throw new RegistryException("Unable to retrieve info for package " + packageName);
        }

        Map<String, JsonNode> versions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> versionFields = document.get("versions").fields();
        while (versionFields.hasNext()) {
            Map.Entry<String, JsonNode> field = versionFields.next();
            versions.put(field.getKey(), field.getValue());
        }

        Map<String, String> distTags = new LinkedHashMap<>();
        JsonNode tags = document.path("dist-tags");
        if (tags.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> tagFields = tags.fields();
            while (tagFields.hasNext()) {
                Map.Entry<String, JsonNode> field = tagFields.next();
                if (field.getValue().isTextual()) {
                    distTags.put(field.getKey(), field.getValue().asText());
                }
            }
        }

        return new PackageInfo(packageName, Collections.unmodifiableMap(versions), Collections.unmodifiableMap(distTags));
    }

    static String encodePackageName(String packageName) {
        return packageName.replace("/", "%2F");
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private record RegistryResponse(HttpStatusCode status, JsonNode body) {
    }
}
