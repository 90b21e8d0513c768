package com.example.hotelconcierge.model.rag;

import com.example.hotelconcierge.model.entity.DocumentChunk;

public record ScoredChunk(DocumentChunk chunk, double score) {
}
