package com.example.hotelconcierge.service;

import com.example.hotelconcierge.model.analysis.Sentiment;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class SentimentAnalyzer {

    static final List<String> POSITIVE_WORDS = List.of(
            "good", "great", "excellent", "amazing", "wonderful", "perfect", "love", "happy");

    static final List<String> NEGATIVE_WORDS = List.of(
            "bad", "terrible", "awful", "horrible", "hate", "angry", "frustrated", "disappointed");

    public Sentiment analyze(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        long positive = POSITIVE_WORDS.stream().filter(lower::contains).count();
        long negative = NEGATIVE_WORDS.stream().filter(lower::contains).count();

        if (negative > positive) {
            return Sentiment.NEGATIVE;
        }
        if (positive > negative) {
            return Sentiment.POSITIVE;
        }
        return Sentiment.NEUTRAL;
    }
}
