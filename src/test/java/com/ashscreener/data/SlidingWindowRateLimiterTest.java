package com.ashscreener.data;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SlidingWindowRateLimiterTest {
    private static final long SECOND = TimeUnit.SECONDS.toNanos(1);

    @Test
    void callsWithinCapacityShouldNotSleep() throws Exception {
        FakeTime time = new FakeTime();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(3, Duration.ofSeconds(60), time::now, time);

        limiter.acquire();
        limiter.acquire();
        limiter.acquire();
        assertTrue(time.sleeps.isEmpty());

        limiter.acquire();
        assertEquals(1, time.sleeps.size());
    }

    @Test
    void callBeyondCapacityShouldSleepUntilOldestLeavesWindow() throws Exception {
        FakeTime time = new FakeTime();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(2, Duration.ofSeconds(60), time::now, time);

        limiter.acquire();
        time.advance(10 * SECOND);
        limiter.acquire();
        time.advance(5 * SECOND);
        limiter.acquire();

        assertEquals(1, time.sleeps.size());
        assertEquals(45 * SECOND, time.sleeps.get(0).longValue());

        // coarse reset: only the call that waited is recorded, so one more fits before the next wait
        limiter.acquire();
        assertEquals(1, time.sleeps.size());
        limiter.acquire();
        assertEquals(2, time.sleeps.size());
        assertEquals(60 * SECOND, time.sleeps.get(1).longValue());
    }

    @Test
    void expiredCallsShouldBePruned() throws Exception {
        FakeTime time = new FakeTime();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(2, Duration.ofSeconds(60), time::now, time);

        limiter.acquire();
        limiter.acquire();
        time.advance(61 * SECOND);
        limiter.acquire();
        limiter.acquire();
        assertTrue(time.sleeps.isEmpty());

        limiter.acquire();
        assertEquals(1, time.sleeps.size());
    }

    @Test
    void nonPositiveCapacityShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowRateLimiter(0, Duration.ofSeconds(60)));
    }

    @Test
    void concurrentCallersShouldNeverExceedCapacityWithoutWaiting() throws Exception {
        FakeTime time = new FakeTime();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(5, Duration.ofSeconds(60), time::now, time);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(12);
        AtomicInteger errors = new AtomicInteger();
        try {
            for (int i = 0; i < 12; i++) {
                pool.submit(() -> {
                    try {
                        limiter.acquire();
                    } catch (InterruptedException e) {
                        errors.incrementAndGet();
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(0, errors.get());
        // 12 calls at capacity 5: the 6th and the 11th wait, each followed by a reset
        assertEquals(2, time.sleeps.size());
    }

    private static final class FakeTime implements SlidingWindowRateLimiter.Sleeper {
        private final AtomicLong nanos = new AtomicLong(1_000L * SECOND);
        final List<Long> sleeps = new ArrayList<>();

        long now() {
            return nanos.get();
        }

        void advance(long delta) {
            nanos.addAndGet(delta);
        }

        @Override
        public synchronized void sleepNanos(long n) {
            sleeps.add(n);
            nanos.addAndGet(n);
        }
    }
}
