package org.pkgcdn.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pkgcdn.cdn.dto.PackageInfo;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpRegistryClientTest {

    private static final String REGISTRY_URL = "https://registry.example.com";

    private MockRestServiceServer server;
    private HttpRegistryClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpRegistryClient(builder.build(), REGISTRY_URL + "/", new ObjectMapper());
    }

    @Test
    void getPackageInfo_parsesVersionsAndDistTags() {
        server.expect(requestTo(REGISTRY_URL + "/demo"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {
                          "name": "demo",
                          "dist-tags": {"latest": "1.2.0", "next": "2.0.0-rc.1"},
                          "versions": {
                            "1.0.0": {"dist": {"tarball": "https://registry.example.com/demo/-/demo-1.0.0.tgz"}},
                            "1.2.0": {"dist": {"tarball": "https://registry.example.com/demo/-/demo-1.2.0.tgz", "shasum": "abc"}}
                          }
                        }
                        """, MediaType.APPLICATION_JSON));

        PackageInfo info = client.getPackageInfo("demo");

        server.verify();
        assertThat(info.name()).isEqualTo("demo");
        assertThat(info.versions()).containsOnlyKeys("1.0.0", "1.2.0");
        assertThat(info.distTags()).containsEntry("latest", "1.2.0").containsEntry("next", "2.0.0-rc.1");
        assertThat(info.tarballUrl("1.2.0")).isEqualTo("https://registry.example.com/demo/-/demo-1.2.0.tgz");
        assertThat(info.shasum("1.2.0")).isEqualTo("abc");
        assertThat(info.shasum("1.0.0")).isNull();
        assertThat(info.tarballUrl("9.9.9")).isNull();
    }

    @Test
    void getPackageInfo_encodesScopeSeparator() {
        server.expect(requestTo(REGISTRY_URL + "/@babel%2Fcore"))
                .andRespond(withSuccess("{\"versions\": {}}", MediaType.APPLICATION_JSON));

        PackageInfo info = client.getPackageInfo("@babel/core");

        server.verify();
        assertThat(info.name()).isEqualTo("@babel/core");
        assertThat(info.versions()).isEmpty();
        assertThat(info.distTags()).isEmpty();
    }

    @Test
    void getPackageInfo_returnsNullForUnknownPackage() {
        server.expect(requestTo(REGISTRY_URL + "/nope"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.getPackageInfo("nope")).isNull();
        server.verify();
    }

    @Test
    void getPackageInfo_failsOnServerError() {
        server.expect(requestTo(REGISTRY_URL + "/demo"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> client.getPackageInfo("demo"))
                .isInstanceOf(RegistryException.class)
                .hasMessageContaining("502");
    }

    @Test
    void getPackageInfo_failsOnTransportError() {
        server.expect(requestTo(REGISTRY_URL + "/demo"))
                .andRespond(withException(new IOException("connection reset")));

        assertThatThrownBy(() -> client.getPackageInfo("demo"))
                .isInstanceOf(RegistryException.class)
                .hasCauseInstanceOf(ResourceAccessException.class);
    }

    @Test
    void getPackageInfo_failsWhenVersionsAreMissing() {
        server.expect(requestTo(REGISTRY_URL + "/demo"))
                .andRespond(withSuccess("{\"name\": \"demo\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.getPackageInfo("demo"))
                .isInstanceOf(RegistryException.class)
                .hasMessage("Unable to retrieve info for package demo");
    }
}
