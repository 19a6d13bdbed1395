package com.ashscreener.session;

import com.ashscreener.model.Criterion;
import com.ashscreener.model.ProgressListener;
import com.ashscreener.model.ScreeningReport;

import java.util.Set;

@FunctionalInterface
public interface ScreeningTask {
    ScreeningReport run(Set<Criterion> criteria, ProgressListener listener) throws Exception;
}
