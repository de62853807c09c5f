package com.golfdata.clubtracker.crawl.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * Sliding-window log: at most {@code maxRequests} grants inside any rolling {@code window}.
 * Waiting happens outside the lock so other callers can still observe freed slots.
 */
public class SlidingWindowRateLimiter implements RequestRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);
    private static final long MAX_SLEEP_CHUNK_NANOS = TimeUnit.MILLISECONDS.toNanos(250);

    private final int maxRequests;
    private final long windowNanos;
    private final Deque<Long> grants = new ArrayDeque<>();
    private final Object lock = new Object();

    public SlidingWindowRateLimiter(int maxRequests, Duration window) {
        this.maxRequests = Math.max(1, maxRequests);
        this.windowNanos = Math.max(1L, window == null ? 0L : window.toNanos());
    }

    @Override
    public void acquire() throws InterruptedException {
        boolean logged = false;
        while (true) {
            long waitNanos;
            synchronized (lock) {
                long now = System.nanoTime();
                evictExpired(now);
                if (grants.size() < maxRequests) {
                    grants.addLast(now);
                    return;
                }
                waitNanos = Math.max(1L, grants.peekFirst() + windowNanos - now);
            }
            if (!logged) {
                log.debug("Rate limit of {} requests per {} ms reached, waiting {} ms",
                    maxRequests,
                    TimeUnit.NANOSECONDS.toMillis(windowNanos),
                    TimeUnit.NANOSECONDS.toMillis(waitNanos));
                logged = true;
            }
            long chunk = Math.min(waitNanos, MAX_SLEEP_CHUNK_NANOS);
            TimeUnit.NANOSECONDS.sleep(chunk);
        }
    }

    public int maxRequests() {
        return maxRequests;
    }

    public Duration window() {
        return Duration.ofNanos(windowNanos);
    }

    private void evictExpired(long now) {
        while (!grants.isEmpty() && now - grants.peekFirst() >= windowNanos) {
            grants.removeFirst();
        }
    }
}
