package com.example.hotelconcierge.service.extraction;

import com.example.hotelconcierge.model.rag.ExtractedText;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Elige extractor por extension del nombre original.
 */
@Service
public class TextExtractionService {

    private final Map<String, TextExtractor> byExtension = new HashMap<>();

    public TextExtractionService(List<TextExtractor> extractors) {
        for (TextExtractor extractor : extractors) {
            for (String ext : extractor.extensions()) {
                byExtension.put(ext, extractor);
            }
        }
    }

    public Set<String> supportedExtensions() {
        return Set.copyOf(byExtension.keySet());
    }

    public boolean supports(String filename) {
        return byExtension.containsKey(extensionOf(filename));
    }

    public ExtractedText extract(Path file, String originalFilename) {
        TextExtractor extractor = byExtension.get(extensionOf(originalFilename));
        if (extractor == null) {
            throw new DocumentExtractionException(originalFilename, "Tipo de fichero no soportado: " + originalFilename);
        }
        return extractor.extract(file, originalFilename);
    }

    public static String extensionOf(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) return "";
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
