package com.example.hotelconcierge.controller;

import com.example.hotelconcierge.config.RagProperties;
import com.example.hotelconcierge.model.dto.DocumentSummary;
import com.example.hotelconcierge.model.dto.RetrievalHit;
import com.example.hotelconcierge.model.rag.IndexingSummary;
import com.example.hotelconcierge.service.DocumentService;
import com.example.hotelconcierge.service.RetrievalService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/documents")
public class DocumentApiController {

    private static final int MAX_LIMIT = 50;

    private final DocumentService documentService;
    private final RetrievalService retrievalService;
    private final RagProperties ragProps;

    public DocumentApiController(DocumentService documentService,
                                 RetrievalService retrievalService,
                                 RagProperties ragProps) {
        this.documentService = documentService;
        this.retrievalService = retrievalService;
        this.ragProps = ragProps;
    }

    @GetMapping("/search")
    public Map<String, Object> search(@RequestParam(name = "q", required = false) String q,
                                                  @RequestParam(name = "category", required = false) String category,
                                                  @RequestParam(name = "limit", required = false) Integer limit) {
        if (q == null || q.isBlank()) {
            return Map.of("results", List.of());
        }
        int effective = limit == null ? ragProps.getTopK() : Math.min(Math.max(limit, 1), MAX_LIMIT);
        // La coincidencia literal distingue espacios; la consulta va tal cual
        List<RetrievalHit> hits = retrievalService.search(q, category, effective);
        return Map.of("query", q, "results", hits, "total", hits.size());
    }

    @GetMapping
    public List<DocumentSummary> list() {
        return documentService.listActive();
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public DocumentSummary upload(@RequestPart("file") MultipartFile file,
                                  @RequestParam(name = "title", required = false) String title,
                                  @RequestParam(name = "category", required = false) String category,
                                  @RequestParam(name = "description", required = false) String description,
                                  @RequestParam(name = "uploadedBy", required = false) String uploadedBy) {
        return documentService.upload(file, title, category, description, uploadedBy);
    }

    @PostMapping("/{id}/reprocess")
    public IndexingSummary reprocess(@PathVariable Long id) {
        return documentService.processDocument(id)
                .orElseThrow(() -> notFound(id));
    }

    @GetMapping("/{id}/content")
    public Map<String, Object> content(@PathVariable Long id) {
        String text = documentService.content(id).orElseThrow(() -> notFound(id));
        return Map.of("id", id, "content", text);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id) {
        if (!documentService.delete(id)) {
            throw notFound(id);
        }
    }

    private static ResponseStatusException notFound(Long id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Documento no encontrado: " + id);
    }
}
