package com.ashscreener.data;

/**
 * The stock universe could not be obtained from upstream, cache or snapshot.
 */
public class UniverseUnavailableException extends IllegalStateException {
    public UniverseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
