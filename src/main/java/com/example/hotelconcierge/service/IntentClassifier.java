package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.analysis.ClassificationResult;
import com.example.hotelconcierge.model.analysis.Intent;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Clasificacion por solapamiento de palabras clave.
 *
 * <p>Score de cada intencion = palabras clave contenidas en el mensaje / total de palabras clave.
 * Gana el maximo; en empate, la primera en {@link Intent#values()}.
 */
@Component
public class IntentClassifier {

    public ClassificationResult classify(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);

        Intent best = null;
        double bestScore = 0.0;
        for (Intent intent : Intent.values()) {
            double score = score(lower, intent);
            if (score > bestScore) {
                best = intent;
                bestScore = score;
            }
        }

        return best == null ? ClassificationResult.fallback() : new ClassificationResult(best, bestScore);
    }

    static double score(String lowerMessage, Intent intent) {
        long matched = intent.keywords().stream().filter(lowerMessage::contains).count();
        return matched / (double) intent.keywords().size();
    }
}
