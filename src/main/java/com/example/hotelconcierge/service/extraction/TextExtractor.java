package com.example.hotelconcierge.service.extraction;

import com.example.hotelconcierge.model.rag.ExtractedText;

import java.nio.file.Path;
import java.util.Set;

public interface TextExtractor {

    /**
     * Extensiones (minusculas, sin punto) que sabe leer.
     */
    Set<String> extensions();

    ExtractedText extract(Path file, String originalFilename);
}
