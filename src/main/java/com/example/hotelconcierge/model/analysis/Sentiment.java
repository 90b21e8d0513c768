package com.example.hotelconcierge.model.analysis;

public enum Sentiment {
    POSITIVE("positive"),
    NEUTRAL("neutral"),
    NEGATIVE("negative");

    private final String wireName;

    Sentiment(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
