package com.ashscreener.data;

import com.ashscreener.cache.CacheStore;
import com.ashscreener.cache.FileCacheStore;
import com.ashscreener.config.Config;
import com.ashscreener.model.Table;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 模块说明：MarketDataService（class）。
 * 主要职责：按数据集组织 RetryingFetcher，对筛选流程提供统一的取数方法。
 * 使用建议：除股票列表外，所有数据集在重试耗尽后返回空表；股票列表失败时回退到快照，快照缺失则抛出异常。
 */
public class MarketDataService {
    private static final Logger LOG = LogManager.getLogger(MarketDataService.class);

    private final MarketDataProvider provider;
    private final CacheStore cache;
    private final StockListSnapshot snapshot;
    private final Map<Dataset, RetryingFetcher> fetchers = new EnumMap<>(Dataset.class);

    public MarketDataService(
            MarketDataProvider provider,
            CacheStore cache,
            RateLimiter rateLimiter,
            RetryPolicy policy,
            StockListSnapshot snapshot
    ) {
        this.provider = provider;
        this.cache = cache;
        this.snapshot = snapshot;
        for (Dataset dataset : Dataset.values()) {
            fetchers.put(dataset, new RetryingFetcher(dataset, cache, rateLimiter, policy));
        }
    }

    /**
     * The limiter must be the one the provider uses for follow-up requests, so every upstream call
     * counts against a single budget.
     */
    public static MarketDataService fromConfig(Config config, MarketDataProvider provider, RateLimiter rateLimiter) {
        return new MarketDataService(
                provider,
                new FileCacheStore(config.getPath("cache.dir")),
                rateLimiter,
                RetryPolicy.fromConfig(config),
                new StockListSnapshot(config.getPath("snapshot.stock_list.path"))
        );
    }

    /**
     * @throws UniverseUnavailableException when neither upstream, cache nor snapshot can supply the list
     */
    public Table stockList() {
        try {
            Table table = fetchers.get(Dataset.STOCK_LIST).fetchOrThrow(() -> {
                Table fetched = provider.stockList();
                if (fetched == null || fetched.isEmpty()) {
                    throw new IllegalStateException("upstream returned an empty stock list");
                }
                return fetched;
            });
            snapshot.save(table);
            LOG.info("stock list loaded: {} rows", table.size());
            return table;
        } catch (FetchExhaustedException e) {
            Optional<Table> fallback = snapshot.load();
            if (fallback.isPresent()) {
                LOG.warn("stock list fetch failed, using snapshot ({} rows): {}", fallback.get().size(), e.getMessage());
                return fallback.get();
            }
            throw new UniverseUnavailableException("stock list unavailable and no snapshot present: " + e.getMessage(), e);
        }
    }

    public Table profitStatement(String code) {
        return fetchers.get(Dataset.PROFIT_STATEMENT).fetch(() -> provider.profitStatement(code), code);
    }

    public Table balanceSheet(String code) {
        return fetchers.get(Dataset.BALANCE_SHEET).fetch(() -> provider.balanceSheet(code), code);
    }

    public Table dividendHistory(String code) {
        return fetchers.get(Dataset.DIVIDEND_HISTORY).fetch(() -> provider.dividendHistory(code), code);
    }

    public Table quote(String code) {
        return fetchers.get(Dataset.QUOTE).fetch(() -> provider.quote(code), code);
    }

    public Table controllerInfo() {
        return fetchers.get(Dataset.CONTROLLER).fetch(provider::controllerInfo);
    }

    public Table pledgeRatios() {
        return fetchers.get(Dataset.PLEDGE).fetch(provider::pledgeRatios);
    }

    public Table buybacks() {
        return fetchers.get(Dataset.BUYBACK).fetch(provider::buybacks);
    }

    public Table additionalIssuances() {
        return fetchers.get(Dataset.ADDITIONAL_ISSUANCE).fetch(provider::additionalIssuances);
    }

    public Table convertibleBonds() {
        return fetchers.get(Dataset.CONVERTIBLE_BOND).fetch(provider::convertibleBonds);
    }

    /**
     * Write time of the cached payload, used for the report's data dates.
     */
    public Optional<Instant> lastUpdated(Dataset dataset, String... args) {
        return cache.lastModified(dataset.cacheKey(args));
    }
}
