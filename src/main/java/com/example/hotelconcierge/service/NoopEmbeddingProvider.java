package com.example.hotelconcierge.service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Proveedor sin modelo: todo texto queda sin vector y la busqueda cae a texto.
 */
public class NoopEmbeddingProvider implements EmbeddingProvider {

    @Override
    public List<Optional<double[]>> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        return Collections.nCopies(texts.size(), Optional.empty());
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public int dimension() {
        return 0;
    }
}
