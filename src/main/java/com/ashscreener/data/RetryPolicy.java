package com.ashscreener.data;

import com.ashscreener.config.Config;

import java.time.Duration;
import java.util.function.Predicate;

public final class RetryPolicy {
    public final int maxAttempts;
    public final Duration delay;
    private final Predicate<Exception> retryable;

    public RetryPolicy(int maxAttempts, Duration delay, Predicate<Exception> retryable) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        this.retryable = retryable == null ? e -> true : retryable;
    }

    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay, e -> !(e instanceof InterruptedException));
    }

    public static RetryPolicy fromConfig(Config config) {
        return fixed(
                Math.max(1, config.getInt("fetch.retry.max_attempts", 3)),
                Duration.ofMillis(Math.max(0L, config.getLong("fetch.retry.delay_ms", 2000L)))
        );
    }

    public boolean isRetryable(Exception e) {
        return retryable.test(e);
    }
}
