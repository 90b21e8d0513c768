package com.example.hotelconcierge.service;

import com.example.hotelconcierge.config.RagProperties;
import com.example.hotelconcierge.model.dto.ChunkView;
import com.example.hotelconcierge.model.dto.DocumentSummary;
import com.example.hotelconcierge.model.dto.RetrievalHit;
import com.example.hotelconcierge.model.entity.DocumentChunk;
import com.example.hotelconcierge.model.rag.ChunkFilter;
import com.example.hotelconcierge.model.rag.ScoredChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);
    static final String CONTEXT_HEADER = "Based on hotel documents:\n\n";

    private final DocumentStore store;
    private final EmbeddingProvider embeddings;
    private final SimilarityRanker ranker;
    private final RagProperties props;

    public RetrievalService(DocumentStore store,
                            EmbeddingProvider embeddings,
                            SimilarityRanker ranker,
                            RagProperties props) {
        this.store = store;
        this.embeddings = embeddings;
        this.ranker = ranker;
        this.props = props;
    }

    public List<RetrievalHit> search(String query) {
        return search(query, null, props.getTopK());
    }

    /**
     * Busqueda semantica sobre chunks de documentos activos; si no hay vector de consulta
     * o ningun candidato tiene embedding, cae a contencion literal con score 0.5.
     */
    public List<RetrievalHit> search(String query, String category, int limit) {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }

        long startNanos = System.nanoTime();
        ChunkFilter filter = ChunkFilter.activeIn(category);
        List<ScoredChunk> scored = null;

        Optional<double[]> queryVector = embeddings.embedOne(query);
        if (queryVector.isPresent()) {
            List<DocumentChunk> candidates = store.queryChunks(filter.embeddedOnly());
            if (!candidates.isEmpty()) {
                scored = ranker.rank(queryVector.get(), candidates, limit);
            }
        }

        boolean semantic = scored != null;
        if (!semantic) {
            scored = ranker.matchText(query, store.queryChunks(filter), limit);
        }

        if (log.isDebugEnabled()) {
            double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;
            log.debug("Busqueda mode={} category={} hits={} limit={} elapsedMs={}",
                    semantic ? "semantic" : "text", filter.category(), scored.size(), limit,
                    String.format(Locale.US, "%.2f", elapsedMs));
        }

        return scored.stream().map(RetrievalService::toHit).toList();
    }

    /**
     * Bloque de contexto para la respuesta; vacio si no hay resultados.
     */
    public String documentContext(String query) {
        List<RetrievalHit> hits;
        try {
            hits = search(query, null, props.getContextLimit());
        } catch (DataAccessException e) {
            log.warn("No se pudo consultar documentos para el contexto: {}", e.getMessage());
            return "";
        }
        if (hits.isEmpty()) {
            return "";
        }

        int snippetLength = Math.max(1, props.getContextSnippetLength());
        StringBuilder sb = new StringBuilder(CONTEXT_HEADER);
        for (RetrievalHit hit : hits) {
            String content = hit.content() == null ? "" : hit.content();
            String snippet = content.length() > snippetLength ? content.substring(0, snippetLength) : content;
            sb.append("- ").append(snippet).append("...\n\n");
        }
        return sb.toString();
    }

    private static RetrievalHit toHit(ScoredChunk sc) {
        DocumentChunk c = sc.chunk();
        return new RetrievalHit(ChunkView.of(c), DocumentSummary.of(c.getDocument()), sc.score(), c.getContent());
    }
}
