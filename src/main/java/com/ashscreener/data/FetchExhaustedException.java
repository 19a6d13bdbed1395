package com.ashscreener.data;

/**
 * Every attempt allowed by the retry policy failed.
 */
public class FetchExhaustedException extends IllegalStateException {
    private final int attempts;

    public FetchExhaustedException(String dataset, int attempts, Throwable lastError) {
        super(dataset + " failed after " + attempts + " attempt(s): "
                + (lastError == null ? "unknown" : lastError.getMessage()), lastError);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
