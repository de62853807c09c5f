package com.golfdata.clubtracker.crawl.http;

import com.golfdata.clubtracker.config.PipelineProperties;

import java.time.Duration;

public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
    }

    public static RetryPolicy from(PipelineProperties.Fetch fetch) {
        return new RetryPolicy(
            fetch.getMaxAttempts(),
            Duration.ofMillis(fetch.getRetryBaseDelayMs()),
            Duration.ofMillis(fetch.getRetryMaxDelayMs())
        );
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Delay before the attempt following {@code failedAttempt}: base * 2^(failedAttempt - 1), capped.
     */
    public Duration delayAfter(int failedAttempt) {
        if (baseDelay.isZero()) {
            return Duration.ZERO;
        }
        int shift = Math.min(30, Math.max(0, failedAttempt - 1));
        long delayMs = baseDelay.toMillis() * (1L << shift);
        if (!maxDelay.isZero()) {
            delayMs = Math.min(delayMs, maxDelay.toMillis());
        }
        return Duration.ofMillis(Math.max(0L, delayMs));
    }
}
