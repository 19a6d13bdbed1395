package com.ashscreener.strategy;

import com.ashscreener.model.Criterion;
import com.ashscreener.model.FilterOutcome;

/**
 * A screening step evaluated independently for each code. Implementations must be thread-safe.
 */
public interface EntityCheck {

    Criterion criterion();

    String label();

    FilterOutcome evaluate(String code);
}
