package com.example.hotelconcierge.service;

import java.util.List;
import java.util.Optional;

/**
 * Capacidad opcional de convertir texto en vectores de dimension fija.
 *
 * <p>Si el backend no esta disponible las implementaciones devuelven un {@link Optional#empty()}
 * por cada texto en lugar de lanzar: la ausencia de vector es un estado esperado.
 */
public interface EmbeddingProvider {

    /**
     * Un resultado por texto, en el mismo orden.
     */
    List<Optional<double[]>> embed(List<String> texts);

    default Optional<double[]> embedOne(String text) {
        List<Optional<double[]>> out = embed(List.of(text));
        return out.isEmpty() ? Optional.empty() : out.get(0);
    }

    boolean isAvailable();

    /**
     * Dimension de los vectores producidos; 0 si no hay modelo.
     */
    int dimension();
}
