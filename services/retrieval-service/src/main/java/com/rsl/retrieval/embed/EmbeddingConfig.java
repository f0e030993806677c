package com.rsl.retrieval.embed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfig {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingConfig.class);

    @Bean
    public RestTemplate embeddingRestTemplate(RestTemplateBuilder builder, EmbeddingProperties properties) {
        if (properties.getMode() == EmbeddingMode.HTTP
            && (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank())) {
            logger.warn("embedding_base_url_missing mode=http semantic search will fall back to fulltext");
        }
        return builder
            .setConnectTimeout(properties.timeout())
            .setReadTimeout(properties.timeout())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }
}
