package com.ashscreener.strategy;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Builds a lookup from a bulk dataset once per screening run, on first use by any worker.
 * An empty result from the loader means the dataset was unavailable.
 */
final class LazyIndex<T> {
    private final Supplier<Optional<T>> loader;
    private volatile boolean loaded;
    private Optional<T> value = Optional.empty();

    LazyIndex(Supplier<Optional<T>> loader) {
        this.loader = loader;
    }

    Optional<T> get() {
        if (!loaded) {
            synchronized (this) {
                if (!loaded) {
                    value = loader.get();
                    loaded = true;
                }
            }
        }
        return value;
    }
}
