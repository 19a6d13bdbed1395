package com.ashscreener.cache;

import com.ashscreener.model.Table;

import java.time.Instant;
import java.util.Optional;

/**
 * Time-bounded persistent store for tabular payloads, keyed by a human-readable logical name.
 * A missing entry, an expired entry and an unreadable entry all look the same to callers.
 */
public interface CacheStore {

    Optional<Table> get(String logicalKey, double maxAgeHours);

    void put(String logicalKey, Table payload);

    Optional<Instant> lastModified(String logicalKey);
}
