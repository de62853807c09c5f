package com.golfdata.clubtracker.crawl.http;

/**
 * Process-wide request budget shared by every source adapter. Callers over budget block.
 */
public interface RequestRateLimiter {

    void acquire() throws InterruptedException;

    static RequestRateLimiter unlimited() {
        return () -> {
        };
    }
}
