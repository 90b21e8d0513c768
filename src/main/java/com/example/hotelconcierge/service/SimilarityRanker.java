package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.entity.DocumentChunk;
import com.example.hotelconcierge.model.rag.ScoredChunk;
import com.example.hotelconcierge.util.VectorMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordena chunks contra un vector de consulta, o los filtra por texto cuando no hay vectores.
 */
@Component
public class SimilarityRanker {

    public static final double TEXT_MATCH_SCORE = 0.5;

    /**
     * Top-k por coseno descendente. Los empates conservan el orden de entrada.
     * Los candidatos sin embedding puntuan 0.
     */
    public List<ScoredChunk> rank(double[] queryVector, List<DocumentChunk> candidates, int limit) {
        if (candidates == null || candidates.isEmpty() || limit <= 0) {
            return List.of();
        }

        List<ScoredChunk> scored = new ArrayList<>(candidates.size());
        for (DocumentChunk chunk : candidates) {
            scored.add(new ScoredChunk(chunk, VectorMath.cosine(queryVector, chunk.getEmbedding())));
        }

        // List.sort es estable
        scored.sort(Comparator.comparingDouble(ScoredChunk::score).reversed());
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : List.copyOf(scored);
    }

    /**
     * Busqueda de respaldo: contencion literal (sensible a mayusculas), en orden de entrada,
     * con score fijo para mantener la misma forma de resultado.
     */
    public List<ScoredChunk> matchText(String query, List<DocumentChunk> candidates, int limit) {
        if (query == null || query.isEmpty() || candidates == null || limit <= 0) {
            return List.of();
        }

        List<ScoredChunk> out = new ArrayList<>();
        for (DocumentChunk chunk : candidates) {
            String content = chunk.getContent();
            if (content != null && content.contains(query)) {
                out.add(new ScoredChunk(chunk, TEXT_MATCH_SCORE));
                if (out.size() >= limit) {
                    break;
                }
            }
        }
        return out;
    }
}
