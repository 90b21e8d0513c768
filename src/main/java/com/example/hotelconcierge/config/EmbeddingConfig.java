package com.example.hotelconcierge.config;

import com.example.hotelconcierge.service.EmbeddingProvider;
import com.example.hotelconcierge.service.NoopEmbeddingProvider;
import com.example.hotelconcierge.service.OllamaClient;
import com.example.hotelconcierge.service.OllamaEmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Elige una unica vez, al arrancar, el proveedor de embeddings del proceso.
 */
@Configuration
public class EmbeddingConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);
    private static final String PROBE_TEXT = "hotel";

    @Bean
    public EmbeddingProvider embeddingProvider(OllamaProperties props, OllamaClient ollama) {
        return select(props, ollama);
    }

    static EmbeddingProvider select(OllamaProperties props, OllamaClient ollama) {
        if (!props.isEmbeddingsEnabled()) {
            log.info("Embeddings desactivados (ollama.embeddings-enabled=false); busqueda por texto");
            return new NoopEmbeddingProvider();
        }

        try {
            List<double[]> probe = ollama.embedMany(List.of(PROBE_TEXT));
            int size = probe.isEmpty() ? 0 : probe.get(0).length;
            if (size != props.getEmbedDimension()) {
                log.warn("Modelo '{}' devuelve dimension {} (esperada {}); embeddings desactivados",
                        props.getEmbedModel(), size, props.getEmbedDimension());
                return new NoopEmbeddingProvider();
            }
        } catch (RestClientException | IllegalStateException e) {
            log.warn("No se pudo inicializar el modelo de embeddings '{}': {}; busqueda por texto",
                    props.getEmbedModel(), e.getMessage());
            return new NoopEmbeddingProvider();
        }

        log.info("Embeddings activos con modelo '{}' (dim={})", props.getEmbedModel(), props.getEmbedDimension());
        return new OllamaEmbeddingProvider(ollama, props.getEmbedDimension());
    }
}
