package com.ashscreener.data;

import com.ashscreener.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * At most {@code maxCalls} calls per rolling window. When the log is full the caller sleeps until
 * the oldest call leaves the window, then the log is cleared and restarted.
 */
public final class SlidingWindowRateLimiter implements RateLimiter {
    private static final Logger LOG = LogManager.getLogger(SlidingWindowRateLimiter.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleepNanos(long nanos) throws InterruptedException;
    }

    private final int maxCalls;
    private final long windowNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Long> calls = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxCalls, Duration window) {
        this(maxCalls, window, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    public static SlidingWindowRateLimiter perMinute(Config config) {
        return new SlidingWindowRateLimiter(
                Math.max(1, config.getInt("ratelimit.max_calls_per_minute", 80)), Duration.ofSeconds(60));
    }

    public SlidingWindowRateLimiter(int maxCalls, Duration window, LongSupplier nanoClock, Sleeper sleeper) {
        if (maxCalls <= 0) {
            throw new IllegalArgumentException("maxCalls must be positive: " + maxCalls);
        }
        this.maxCalls = maxCalls;
        this.windowNanos = Math.max(1L, window.toNanos());
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    @Override
    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long now = nanoClock.getAsLong();
            prune(now);
            if (calls.size() >= maxCalls) {
                long waitNanos = calls.peekFirst() + windowNanos - now;
                if (waitNanos > 0L) {
                    LOG.info("rate limit reached ({} calls/window), waiting {} ms",
                            maxCalls, TimeUnit.NANOSECONDS.toMillis(waitNanos));
                    sleeper.sleepNanos(waitNanos);
                }
                calls.clear();
                now = nanoClock.getAsLong();
            }
            calls.addLast(now);
        } finally {
            lock.unlock();
        }
    }

    private void prune(long now) {
        while (!calls.isEmpty() && now - calls.peekFirst() >= windowNanos) {
            calls.pollFirst();
        }
    }
}
