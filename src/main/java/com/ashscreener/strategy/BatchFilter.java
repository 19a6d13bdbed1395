package com.ashscreener.strategy;

import com.ashscreener.model.Criterion;
import com.ashscreener.model.ProgressListener;

import java.util.List;

/**
 * A screening step evaluated against the whole surviving code set at once.
 */
public interface BatchFilter {

    Criterion criterion();

    String label();

    /**
     * Survivors in input order. When the backing dataset is unavailable the input is returned unchanged.
     */
    List<String> apply(List<String> codes, ProgressListener listener);
}
