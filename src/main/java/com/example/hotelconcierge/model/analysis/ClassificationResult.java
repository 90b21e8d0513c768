package com.example.hotelconcierge.model.analysis;

/**
 * Intencion ganadora y su confianza en [0, 1].
 */
public record ClassificationResult(Intent intent, double confidence) {

    public static final double DEFAULT_CONFIDENCE = 0.5;

    public static ClassificationResult fallback() {
        return new ClassificationResult(Intent.INQUIRY, DEFAULT_CONFIDENCE);
    }
}
