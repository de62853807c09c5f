package com.golfdata.clubtracker.crawl.http;

import com.golfdata.clubtracker.crawl.model.FetchError;
import com.golfdata.clubtracker.crawl.util.FetchErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.IntFunction;

/**
 * Runs a fallible operation under a {@link RetryPolicy}. Transient errors are retried with
 * exponential backoff; permanent errors stop immediately. Once the ceiling is reached the
 * last error is surfaced as permanent.
 */
public final class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private RetryExecutor() {}

    public static <T> RetryResult<T> execute(String operation, RetryPolicy policy, IntFunction<Attempt<T>> call) {
        Attempt<T> last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            last = call.apply(attempt);
            if (last == null) {
                last = Attempt.failure(FetchError.permanent(FetchErrorClassifier.HTTP_ERROR, "no result", 0));
            }
            if (last.error() == null) {
                return new RetryResult<>(last.value(), null, attempt);
            }
            if (!last.error().isTransient()) {
                return new RetryResult<>(null, last.error(), attempt);
            }
            if (attempt >= policy.maxAttempts()) {
                break;
            }
            Duration delay = policy.delayAfter(attempt);
            log.debug(
                "{} failed on attempt {}/{} ({}), retrying in {} ms",
                operation,
                attempt,
                policy.maxAttempts(),
                last.error().code(),
                delay.toMillis()
            );
            if (!sleep(delay)) {
                return new RetryResult<>(
                    null,
                    FetchError.permanent(FetchErrorClassifier.INTERRUPTED, "interrupted during backoff", 0),
                    attempt
                );
            }
        }
        return new RetryResult<>(null, last.error().exhausted(policy.maxAttempts()), policy.maxAttempts());
    }

    private static boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public record Attempt<T>(T value, FetchError error) {
        public static <T> Attempt<T> success(T value) {
            return new Attempt<>(value, null);
        }

        public static <T> Attempt<T> failure(FetchError error) {
            return new Attempt<>(null, error);
        }
    }

    public record RetryResult<T>(T value, FetchError error, int attempts) {
        public boolean isSuccessful() {
            return error == null;
        }
    }
}
