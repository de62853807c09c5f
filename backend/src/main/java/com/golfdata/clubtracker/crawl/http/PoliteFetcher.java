package com.golfdata.clubtracker.crawl.http;

import com.golfdata.clubtracker.config.PipelineProperties;
import com.golfdata.clubtracker.crawl.model.FetchError;
import com.golfdata.clubtracker.crawl.model.FetchOutcome;
import com.golfdata.clubtracker.crawl.model.HttpFetchResult;
import com.golfdata.clubtracker.crawl.util.FetchErrorClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ExecutorService;

@Service
public class PoliteFetcher {
    private static final Logger log = LoggerFactory.getLogger(PoliteFetcher.class);
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final PipelineProperties properties;
    private final HttpClient client;
    private final RequestRateLimiter rateLimiter;
    private final UserAgentRotator userAgentRotator;

    public PoliteFetcher(
        PipelineProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        RequestRateLimiter rateLimiter,
        UserAgentRotator userAgentRotator
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getFetch().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.rateLimiter = rateLimiter;
        this.userAgentRotator = userAgentRotator;
    }

    public FetchOutcome fetch(String url) {
        return fetch(url, Map.of());
    }

    public FetchOutcome fetch(String url, Map<String, String> params) {
        Instant startedAt = Instant.now();
        String target = withQuery(url, params);
        RetryPolicy policy = RetryPolicy.from(properties.getFetch());
        RetryExecutor.RetryResult<HttpFetchResult> result = RetryExecutor.execute(
            "GET " + target,
            policy,
            attempt -> {
                HttpFetchResult exchange = executeOnce(target);
                FetchError error = FetchErrorClassifier.classify(exchange);
                return error == null
                    ? RetryExecutor.Attempt.success(exchange)
                    : RetryExecutor.Attempt.failure(error);
            }
        );
        Duration elapsed = Duration.between(startedAt, Instant.now());
        if (!result.isSuccessful()) {
            log.warn("Fetch failed for {} after {} attempt(s): {}", target, result.attempts(), result.error().describe());
            return FetchOutcome.failure(target, result.error(), result.attempts(), elapsed);
        }

        HttpFetchResult exchange = result.value();
        String finalUrl = exchange.finalUrlOrRequested();
        Document document;
        try {
            document = Jsoup.parse(exchange.body(), finalUrl);
        } catch (RuntimeException e) {
            FetchError error = FetchError.permanent("malformed_body", e.getMessage(), exchange.statusCode());
            log.warn("Unparsable response body from {}: {}", target, e.getMessage());
            return FetchOutcome.failure(target, error, result.attempts(), elapsed);
        }
        log.debug("Fetched {} status={} attempts={} in {} ms", target, exchange.statusCode(), result.attempts(), elapsed.toMillis());
        return FetchOutcome.success(target, finalUrl, exchange.statusCode(), document, result.attempts(), elapsed);
    }

    private HttpFetchResult executeOnce(String url) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, FetchErrorClassifier.INVALID_URL, "URL missing host or malformed");
        }

        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, FetchErrorClassifier.INTERRUPTED, e.getMessage());
        }

        try {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getFetch().getRequestTimeoutSeconds()))
                .header("User-Agent", userAgentRotator.next())
                .header("Accept", ACCEPT_HTML)
                .header("Accept-Language", "en-US,en;q=0.5")
                .GET()
                .build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, FetchErrorClassifier.TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, FetchErrorClassifier.IO_ERROR, describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, FetchErrorClassifier.INTERRUPTED, e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, FetchErrorClassifier.HTTP_ERROR, e.getMessage());
        } finally {
            politeDelay();
        }
    }

    private void politeDelay() {
        int delayMs = properties.getFetch().getPostRequestDelayMs();
        if (delayMs <= 0 || Thread.currentThread().isInterrupted()) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private String describe(IOException e) {
        String message = e.getMessage();
        String type = e.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }

    static String withQuery(String url, Map<String, String> params) {
        if (url == null || params == null || params.isEmpty()) {
            return url;
        }
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            joiner.add(
                URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8)
            );
        }
        String query = joiner.toString();
        if (query.isEmpty()) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
