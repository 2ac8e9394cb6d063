package com.phillippitts.feedercontrol.service.remote;

import com.phillippitts.feedercontrol.exception.ConfigUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestRemoteStoreTest {

    private MockRestServiceServer server;
    private RestRemoteStore store;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://store.test");
        server = MockRestServiceServer.bindTo(builder).build();
        store = new RestRemoteStore(builder.build(), "tok");
    }

    @Test
    void getReadsJsonNode() {
        server.expect(requestTo("http://store.test/app_setting/duration.json?auth=tok"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"syncSensors\": 5}", MediaType.APPLICATION_JSON));

        Map<String, Object> node = store.getMap("app_setting/duration");

        assertThat(node).containsEntry("syncSensors", 5);
        server.verify();
    }

    @Test
    void missingNodeReadsAsEmpty() {
        server.expect(requestTo("http://store.test/alerts/active.json?auth=tok"))
                .andRespond(withSuccess("null", MediaType.APPLICATION_JSON));

        assertThat(store.get("alerts/active")).isEmpty();
    }

    @Test
    void pushReturnsGeneratedKey() {
        server.expect(requestTo("http://store.test/alerts/logs.json?auth=tok"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"action\": \"trigger\"}"))
                .andRespond(withSuccess("{\"name\": \"-Nabc\"}", MediaType.APPLICATION_JSON));

        assertThat(store.push("alerts/logs", Map.of("action", "trigger"))).isEqualTo("-Nabc");
    }

    @Test
    void nullValueDeletesNode() {
        server.expect(requestTo("http://store.test/alerts/active/x.json?auth=tok"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());

        store.set("alerts/active/x", null);

        server.verify();
    }

    @Test
    void serverErrorSurfacesAsConfigUnavailable() {
        server.expect(requestTo("http://store.test/sensors.json?auth=tok"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> store.set("sensors", Map.of("temperature", 25.0)))
                .isInstanceOf(ConfigUnavailableException.class)
                .hasMessageContaining("sensors");
    }
}
