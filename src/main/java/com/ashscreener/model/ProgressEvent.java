package com.ashscreener.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class ProgressEvent {
    public static final String STAGE_INIT = "init";
    public static final String STAGE_DONE = "done";

    public final String message;
    public final String stage;
    public final int remaining;
}
