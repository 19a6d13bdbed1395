package com.ashscreener.data;

/**
 * Call-rate governor shared by every upstream request.
 */
public interface RateLimiter {

    /**
     * Blocks until one more call fits into the limit.
     */
    void acquire() throws InterruptedException;

    static RateLimiter unlimited() {
        return () -> {
        };
    }
}
