package com.golfdata.clubtracker.crawl.model;

import org.jsoup.nodes.Document;

import java.time.Duration;

public record FetchOutcome(
    String requestedUrl,
    String finalUrl,
    int statusCode,
    Document document,
    FetchError error,
    int attempts,
    Duration elapsed
) {
    public static FetchOutcome success(
        String requestedUrl,
        String finalUrl,
        int statusCode,
        Document document,
        int attempts,
        Duration elapsed
    ) {
        return new FetchOutcome(requestedUrl, finalUrl, statusCode, document, null, attempts, elapsed);
    }

    public static FetchOutcome failure(String requestedUrl, FetchError error, int attempts, Duration elapsed) {
        int status = error == null ? 0 : error.statusCode();
        return new FetchOutcome(requestedUrl, requestedUrl, status, null, error, attempts, elapsed);
    }

    public boolean isSuccessful() {
        return error == null && document != null;
    }
}
