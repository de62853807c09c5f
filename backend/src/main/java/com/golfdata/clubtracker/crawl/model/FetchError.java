package com.golfdata.clubtracker.crawl.model;

import java.util.Locale;

public record FetchError(
    FetchErrorKind kind,
    String code,
    String message,
    int statusCode
) {
    public static final String RETRIES_EXHAUSTED = "retries_exhausted";

    public static FetchError transientError(String code, String message, int statusCode) {
        return new FetchError(FetchErrorKind.TRANSIENT, code, message, statusCode);
    }

    public static FetchError permanent(String code, String message, int statusCode) {
        return new FetchError(FetchErrorKind.PERMANENT, code, message, statusCode);
    }

    public boolean isTransient() {
        return kind == FetchErrorKind.TRANSIENT;
    }

    /**
     * The error surfaced once the attempt ceiling is reached: permanent, keeping the last cause.
     */
    public FetchError exhausted(int attempts) {
        String detail = code + " after " + attempts + " attempts"
            + (message == null || message.isBlank() ? "" : ": " + message);
        return new FetchError(FetchErrorKind.PERMANENT, RETRIES_EXHAUSTED, detail, statusCode);
    }

    public String describe() {
        StringBuilder sb = new StringBuilder(kind.name().toLowerCase(Locale.ROOT)).append(':').append(code);
        if (statusCode > 0) {
            sb.append(" status=").append(statusCode);
        }
        if (message != null && !message.isBlank()) {
            sb.append(' ').append(message);
        }
        return sb.toString();
    }
}
