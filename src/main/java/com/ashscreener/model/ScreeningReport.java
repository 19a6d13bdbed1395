package com.ashscreener.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ScreeningReport {
    public final int totalInitial;
    public final List<StageResult> stages;
    public final List<String> passed;
    public final Map<String, String> stockNames;
    public final int finalCount;
    public final List<Integer> selectedCriteria;
    public final Map<String, String> dataDates;
}
