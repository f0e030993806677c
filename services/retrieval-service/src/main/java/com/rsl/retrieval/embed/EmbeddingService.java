package com.rsl.retrieval.embed;

import com.rsl.retrieval.resilience.CircuitBreaker;
import com.rsl.retrieval.resilience.ResilienceProperties;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Embedding provider used by search and indexing. HTTP mode goes through the gateway behind a
 * circuit breaker; local mode uses {@link ToyEmbedder}. Failures surface as
 * {@link EmbeddingOutcome#transientFailure(String)}, never as exceptions.
 */
@Component
public class EmbeddingService implements EmbeddingProvider {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final ToyEmbedder toyEmbedder;
    private final EmbeddingCacheService cacheService;
    private final CircuitBreaker breaker;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        ToyEmbedder toyEmbedder,
        EmbeddingCacheService cacheService,
        ResilienceProperties resilienceProperties
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.toyEmbedder = toyEmbedder;
        this.cacheService = cacheService;
        this.breaker = new CircuitBreaker(
            "embedding",
            resilienceProperties.getEmbedFailureThreshold(),
            resilienceProperties.getEmbedOpenMs()
        );
    }

    @Override
    public EmbeddingOutcome generate(String text, String model) {
        if (text == null || text.isBlank()) {
            return EmbeddingOutcome.transientFailure("embed_empty_text");
        }
        if (cacheService.isEnabled()) {
            Optional<EmbeddingVector> cached = cacheService.get(text, model);
            if (cached.isPresent()) {
                return EmbeddingOutcome.generated(cached.get());
            }
        }
        EmbeddingOutcome outcome = fetch(text, model);
        if (outcome.isGenerated() && cacheService.isEnabled()) {
            cacheService.put(text, model, outcome.getVector());
        }
        return outcome;
    }

    CircuitBreaker getBreaker() {
        return breaker;
    }

    private EmbeddingOutcome fetch(String text, String model) {
        if (properties.getMode() == EmbeddingMode.LOCAL) {
            return EmbeddingOutcome.generated(toyEmbedder.embed(text));
        }
        if (!breaker.allowRequest()) {
            return EmbeddingOutcome.transientFailure("embed_circuit_open");
        }
        try {
            EmbeddingVector vector = embeddingGateway.embed(text, model);
            breaker.recordSuccess();
            return EmbeddingOutcome.generated(vector);
        } catch (EmbeddingUnavailableException ex) {
            if (breaker.recordFailure()) {
                logger.warn("embedding_circuit_opened reason={}", ex.getReason());
            }
            return EmbeddingOutcome.transientFailure(ex.getReason());
        }
    }
}
