package com.example.hotelconcierge.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.hotelconcierge.service.EmbeddingProvider;
import com.example.hotelconcierge.service.NoopEmbeddingProvider;
import com.example.hotelconcierge.service.OllamaClient;
import com.example.hotelconcierge.service.OllamaEmbeddingProvider;
import java.util.List;
import org.junit.jupiter.api.Test;

class EmbeddingConfigTest {

    private final OllamaClient ollama = mock(OllamaClient.class);

    @Test
    void disabledEmbeddingsSelectNoopWithoutProbing() {
        OllamaProperties props = new OllamaProperties();
        props.setEmbeddingsEnabled(false);

        EmbeddingProvider provider = EmbeddingConfig.select(props, ollama);

        assertThat(provider).isInstanceOf(NoopEmbeddingProvider.class);
        assertThat(provider.isAvailable()).isFalse();
        verifyNoInteractions(ollama);
    }

    @Test
    void probeWithExpectedDimensionSelectsOllama() {
        OllamaProperties props = new OllamaProperties();
        props.setEmbedDimension(4);
        when(ollama.embedMany(anyList())).thenReturn(List.of(new double[] {0.1, 0.2, 0.3, 0.4}));

        EmbeddingProvider provider = EmbeddingConfig.select(props, ollama);

        assertThat(provider).isInstanceOf(OllamaEmbeddingProvider.class);
        assertThat(provider.dimension()).isEqualTo(4);
    }

    @Test
    void wrongDimensionOrUnreachableBackendSelectsNoop() {
        OllamaProperties props = new OllamaProperties();
        props.setEmbedDimension(384);
        when(ollama.embedMany(anyList())).thenReturn(List.of(new double[] {0.1, 0.2}));

        assertThat(EmbeddingConfig.select(props, ollama)).isInstanceOf(NoopEmbeddingProvider.class);

        when(ollama.embedMany(anyList())).thenThrow(new IllegalStateException("Ollama embeddings fallo"));

        assertThat(EmbeddingConfig.select(props, ollama)).isInstanceOf(NoopEmbeddingProvider.class);
    }
}
