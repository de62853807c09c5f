package com.golfdata.clubtracker.crawl.util;

import com.golfdata.clubtracker.crawl.model.FetchError;
import com.golfdata.clubtracker.crawl.model.HttpFetchResult;

import java.util.Locale;

public final class FetchErrorClassifier {
    public static final String INVALID_URL = "invalid_url";
    public static final String INTERRUPTED = "interrupted";
    public static final String TIMEOUT = "timeout";
    public static final String IO_ERROR = "io_error";
    public static final String DNS_FAILURE = "dns_failure";
    public static final String HTTP_ERROR = "http_error";
    public static final String HTTP_429_RATE_LIMIT = "http_429_rate_limit";
    public static final String HTTP_4XX = "http_4xx";
    public static final String HTTP_5XX = "http_5xx";
    public static final String EMPTY_BODY = "empty_body";
    public static final String UNEXPECTED_STATUS = "unexpected_status";

    private FetchErrorClassifier() {}

    /**
     * Classifies a single exchange. Returns {@code null} when the exchange succeeded.
     */
    public static FetchError classify(HttpFetchResult result) {
        if (result == null) {
            return FetchError.permanent(HTTP_ERROR, "no result", 0);
        }
        if (result.errorCode() != null && !result.errorCode().isBlank()) {
            return fromErrorCode(result.errorCode(), result.errorMessage());
        }
        int status = result.statusCode();
        if (status >= 200 && status < 300) {
            if (result.body() == null || result.body().isBlank()) {
                return FetchError.permanent(EMPTY_BODY, "response body was empty", status);
            }
            return null;
        }
        return fromHttpStatus(status);
    }

    public static FetchError fromHttpStatus(int status) {
        if (status == 408) {
            return FetchError.transientError(TIMEOUT, "request timeout", status);
        }
        if (status == 429) {
            return FetchError.transientError(HTTP_429_RATE_LIMIT, "rate limited by source", status);
        }
        if (status >= 500 && status < 600) {
            return FetchError.transientError(HTTP_5XX, "server error", status);
        }
        if (status >= 400 && status < 500) {
            return FetchError.permanent(HTTP_4XX, "client error", status);
        }
        return FetchError.permanent(UNEXPECTED_STATUS, "unexpected status", status);
    }

    public static FetchError fromErrorCode(String errorCode, String errorMessage) {
        String code = errorCode.toLowerCase(Locale.ROOT);
        if (code.equals(INVALID_URL) || code.equals(INTERRUPTED)) {
            return FetchError.permanent(code, errorMessage, 0);
        }
        if (code.contains(TIMEOUT)) {
            return FetchError.transientError(TIMEOUT, errorMessage, 0);
        }
        String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
        if (lower.contains("unknownhost")
            || lower.contains("name or service not known")
            || lower.contains("no such host")) {
            // retried like any connection failure; surfaces as permanent once exhausted
            return FetchError.transientError(DNS_FAILURE, errorMessage, 0);
        }
        if (code.equals(IO_ERROR)) {
            return FetchError.transientError(IO_ERROR, errorMessage, 0);
        }
        return FetchError.permanent(HTTP_ERROR, errorMessage, 0);
    }
}
