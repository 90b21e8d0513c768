package com.example.hotelconcierge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Embeddings via Ollama. Un fallo del backend degrada a "sin vector" para todo el lote.
 */
public class OllamaEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);

    private final OllamaClient ollama;
    private final int dimension;

    public OllamaEmbeddingProvider(OllamaClient ollama, int dimension) {
        this.ollama = ollama;
        this.dimension = dimension;
    }

    @Override
    public List<Optional<double[]>> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        List<double[]> raw;
        try {
            raw = ollama.embedMany(texts);
        } catch (RestClientException | IllegalStateException e) {
            log.warn("Embeddings no disponibles para {} textos, se sigue sin vectores: {}", texts.size(), e.getMessage());
            return Collections.nCopies(texts.size(), Optional.empty());
        }

        List<Optional<double[]>> out = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            double[] vector = i < raw.size() ? raw.get(i) : null;
            if (vector == null || vector.length != dimension) {
                if (vector != null && vector.length > 0) {
                    log.warn("Embedding con dimension {} (esperada {}), se descarta", vector.length, dimension);
                }
                out.add(Optional.empty());
            } else {
                out.add(Optional.of(vector));
            }
        }
        return out;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
