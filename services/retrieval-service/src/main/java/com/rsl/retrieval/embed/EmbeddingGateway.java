package com.rsl.retrieval.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.SocketTimeoutException;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the embedding service ({@code POST /v1/embed}). Every transport or protocol
 * failure is raised as {@link EmbeddingUnavailableException} carrying a reason code.
 */
@Component
public class EmbeddingGateway {
    static final String EMBED_PATH = "/v1/embed";

    private final RestTemplate restTemplate;
    private final EmbeddingProperties properties;

    public EmbeddingGateway(
        @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
        EmbeddingProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public EmbeddingVector embed(String text, String model) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        String baseUrl = properties.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new EmbeddingUnavailableException("embed_base_url_missing");
        }
        String resolvedModel = properties.resolveModel(model);
        String url = stripTrailingSlash(baseUrl) + EMBED_PATH;

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<EmbedRequest> entity = new HttpEntity<>(new EmbedRequest(resolvedModel, List.of(text), true), headers);

        int attempts = 1 + Math.max(0, properties.getRetryCount());
        RestClientException lastFailure = null;
        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                return toVector(restTemplate.postForObject(url, entity, EmbedResponse.class), resolvedModel);
            } catch (RestClientException e) {
                lastFailure = e;
            }
        }
        throw new EmbeddingUnavailableException(reasonFor(lastFailure), lastFailure);
    }

    private static EmbeddingVector toVector(EmbedResponse body, String requestedModel) {
        if (body == null || body.vectors() == null || body.vectors().isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_response");
        }
        List<Double> first = body.vectors().get(0);
        if (first == null || first.isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_vector");
        }
        return EmbeddingVector.of(first, body.model() == null ? requestedModel : body.model());
    }

    static String reasonFor(RestClientException failure) {
        if (failure instanceof HttpStatusCodeException statusFailure) {
            return "embed_http_" + statusFailure.getStatusCode().value();
        }
        if (failure instanceof ResourceAccessException && failure.getCause() instanceof SocketTimeoutException) {
            return "embed_timeout";
        }
        return "embed_unavailable";
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    public record EmbedRequest(String model, List<String> texts, boolean normalize) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbedResponse(String model, List<List<Double>> vectors) {
    }
}
