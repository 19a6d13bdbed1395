package com.ashscreener.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ProgressSnapshot {
    public final String sessionId;
    public final SessionState state;
    public final boolean running;
    public final String stage;
    public final String message;
    public final int remaining;
    public final String error;

    public static ProgressSnapshot idle() {
        return new ProgressSnapshot("", SessionState.IDLE, false, "", "", 0, null);
    }
}
