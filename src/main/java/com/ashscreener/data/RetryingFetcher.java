package com.ashscreener.data;

import com.ashscreener.cache.CacheStore;
import com.ashscreener.model.Table;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * 模块说明：RetryingFetcher（class）。
 * 主要职责：单个数据集的取数入口，先查缓存，未命中时经限流器调用上游，失败按固定间隔重试。
 * 使用建议：实例无内部可变状态，可被多个工作线程并发调用。
 */
public final class RetryingFetcher {
    private static final Logger LOG = LogManager.getLogger(RetryingFetcher.class);

    private final Dataset dataset;
    private final CacheStore cache;
    private final RateLimiter rateLimiter;
    private final RetryPolicy policy;

    public RetryingFetcher(Dataset dataset, CacheStore cache, RateLimiter rateLimiter, RetryPolicy policy) {
        this.dataset = dataset;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.policy = policy;
    }

    /**
     * Cached or freshly fetched payload; an empty table once retries are exhausted.
     */
    public Table fetch(UpstreamCall call, String... args) {
        try {
            return fetchOrThrow(call, args);
        } catch (FetchExhaustedException e) {
            LOG.warn("{}: degraded to empty payload, {}", dataset.cacheKey(args), e.getMessage());
            return Table.empty();
        }
    }

    /**
     * @throws FetchExhaustedException when every attempt failed or the thread was interrupted
     */
    public Table fetchOrThrow(UpstreamCall call, String... args) {
        String key = dataset.cacheKey(args);
        Optional<Table> cached = cache.get(key, dataset.ttlHours);
        if (cached.isPresent()) {
            LOG.debug("cache hit: {}", key);
            return cached.get();
        }

        Exception lastError = null;
        int attempt = 0;
        while (attempt < policy.maxAttempts) {
            attempt++;
            try {
                rateLimiter.acquire();
                Table table = call.call();
                if (table == null) {
                    table = Table.empty();
                }
                cache.put(key, table);
                return table;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchExhaustedException(key, attempt, e);
            } catch (Exception e) {
                lastError = e;
                if (attempt >= policy.maxAttempts || !policy.isRetryable(e)) {
                    break;
                }
                LOG.warn("{} attempt {} failed: {}, retrying...", key, attempt, e.getMessage());
                if (!pause()) {
                    throw new FetchExhaustedException(key, attempt, e);
                }
            }
        }
        throw new FetchExhaustedException(key, attempt, lastError);
    }

    private boolean pause() {
        long millis = policy.delay.toMillis();
        if (millis <= 0L) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
