package com.example.hotelconcierge.model.rag;

import java.util.List;

public record ExtractedText(String text, List<PageBoundary> pages) {

    public ExtractedText {
        text = text == null ? "" : text;
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public static ExtractedText singlePage(String text) {
        String body = text == null ? "" : text;
        return new ExtractedText(body, List.of(new PageBoundary(1, 0, body.length())));
    }
}
