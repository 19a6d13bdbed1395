package com.ashscreener.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class StageResult {
    public final int criterionId;
    public final String criterion;
    public final int before;
    public final int after;
    public final int eliminated;

    public static StageResult of(Criterion criterion, String label, int before, int after) {
        return new StageResult(criterion.id, label, before, after, before - after);
    }
}
