package com.rsl.retrieval.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class EmbeddingGatewayTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static EmbeddingProperties properties() {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setBaseUrl("http://localhost:8088/");
        properties.setModel("all-MiniLM-L6-v2");
        return properties;
    }

    @Test
    void postsSingleTextAndReadsFirstVector() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties());

        server.expect(requestTo("http://localhost:8088/v1/embed"))
            .andExpect(method(POST))
            .andExpect(request -> {
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                JsonNode root = objectMapper.readTree(body);
                assertThat(root.path("model").asText()).isEqualTo("all-MiniLM-L6-v2");
                assertThat(root.path("texts").get(0).asText()).isEqualTo("renewal terms");
                assertThat(root.path("normalize").asBoolean()).isTrue();
            })
            .andRespond(withSuccess(
                "{\"model\":\"all-MiniLM-L6-v2\",\"vectors\":[[0.6,0.8]]}",
                MediaType.APPLICATION_JSON
            ));

        EmbeddingVector vector = gateway.embed("renewal terms", null);

        server.verify();
        assertThat(vector.values()).containsExactly(0.6f, 0.8f);
        assertThat(vector.model()).isEqualTo("all-MiniLM-L6-v2");
    }

    @Test
    void serverErrorMapsToReasonCode() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties());

        server.expect(requestTo("http://localhost:8088/v1/embed")).andRespond(withServerError());

        assertThatThrownBy(() -> gateway.embed("renewal terms", "m"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_http_500");
    }

    @Test
    void emptyVectorListIsUnavailable() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties());

        server.expect(requestTo("http://localhost:8088/v1/embed"))
            .andRespond(withSuccess("{\"vectors\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.embed("renewal terms", "m"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_empty_response");
    }

    @Test
    void missingBaseUrlFailsFast() {
        EmbeddingProperties properties = properties();
        properties.setBaseUrl(" ");
        EmbeddingGateway gateway = new EmbeddingGateway(new RestTemplate(), properties);

        assertThatThrownBy(() -> gateway.embed("renewal terms", "m"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_base_url_missing");
    }
}
