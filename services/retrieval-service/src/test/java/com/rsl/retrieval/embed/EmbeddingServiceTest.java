package com.rsl.retrieval.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rsl.retrieval.resilience.ResilienceProperties;
import org.junit.jupiter.api.Test;

class EmbeddingServiceTest {

    private final EmbeddingGateway gateway = mock(EmbeddingGateway.class);

    private EmbeddingService service(EmbeddingProperties properties, int failureThreshold) {
        ResilienceProperties resilience = new ResilienceProperties();
        resilience.setEmbedFailureThreshold(failureThreshold);
        resilience.setEmbedOpenMs(60_000L);
        return new EmbeddingService(
            properties,
            gateway,
            new ToyEmbedder(properties),
            new EmbeddingCacheService(properties),
            resilience
        );
    }

    private static EmbeddingProperties properties(EmbeddingMode mode) {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setMode(mode);
        properties.setModel("m");
        properties.setDimensions(8);
        return properties;
    }

    @Test
    void localModeIsDeterministicAndUnitLength() {
        EmbeddingService service = service(properties(EmbeddingMode.LOCAL), 3);

        EmbeddingOutcome first = service.generate("quarterly report", "m");
        EmbeddingOutcome second = service.generate("quarterly report", "m");

        assertThat(first.isGenerated()).isTrue();
        assertThat(first.getVector().values()).containsExactly(second.getVector().values());
        assertThat(first.getVector().dimensions()).isEqualTo(8);
        double sum = 0.0;
        for (float value : first.getVector().values()) {
            sum += value * value;
        }
        assertThat(Math.sqrt(sum)).isBetween(0.999, 1.001);
        verify(gateway, never()).embed(anyString(), anyString());
    }

    @Test
    void emptyTextIsTransientFailure() {
        EmbeddingService service = service(properties(EmbeddingMode.HTTP), 3);

        EmbeddingOutcome outcome = service.generate("  ", "m");

        assertThat(outcome.isGenerated()).isFalse();
        assertThat(outcome.getReason()).isEqualTo("embed_empty_text");
    }

    @Test
    void gatewayFailureBecomesTransientFailure() {
        when(gateway.embed("q", "m")).thenThrow(new EmbeddingUnavailableException("embed_timeout"));
        EmbeddingService service = service(properties(EmbeddingMode.HTTP), 3);

        EmbeddingOutcome outcome = service.generate("q", "m");

        assertThat(outcome.isGenerated()).isFalse();
        assertThat(outcome.getReason()).isEqualTo("embed_timeout");
    }

    @Test
    void breakerOpensAfterThresholdAndShortCircuits() {
        when(gateway.embed("q", "m")).thenThrow(new EmbeddingUnavailableException("embed_unavailable"));
        EmbeddingService service = service(properties(EmbeddingMode.HTTP), 2);

        service.generate("q", "m");
        service.generate("q", "m");
        EmbeddingOutcome outcome = service.generate("q", "m");

        assertThat(outcome.getReason()).isEqualTo("embed_circuit_open");
        assertThat(service.getBreaker().isOpen()).isTrue();
        verify(gateway, times(2)).embed("q", "m");
    }

    @Test
    void cachedVectorSkipsGateway() {
        EmbeddingProperties properties = properties(EmbeddingMode.HTTP);
        properties.getCache().setEnabled(true);
        when(gateway.embed("q", "m")).thenReturn(new EmbeddingVector(new float[] {0.6f, 0.8f}, "m"));
        EmbeddingService service = service(properties, 3);

        EmbeddingOutcome first = service.generate("q", "m");
        EmbeddingOutcome second = service.generate("q", "m");

        assertThat(first.isGenerated()).isTrue();
        assertThat(second.getVector().values()).containsExactly(0.6f, 0.8f);
        verify(gateway, times(1)).embed("q", "m");
    }
}
