package com.ashscreener.runner;

import com.ashscreener.model.FilterOutcome;
import com.ashscreener.model.ProgressEvent;
import com.ashscreener.model.ProgressListener;
import com.ashscreener.strategy.EntityCheck;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 模块说明：IndividualCheckRunner（class）。
 * 主要职责：用有界线程池逐只执行单项检查，按完成顺序汇总结果，全部完成后才返回。
 * 使用建议：只有 FAIL 会淘汰股票；INDETERMINATE 与异常都保留该股票，避免数据缺失被误判为不合格。
 */
public final class IndividualCheckRunner {
    private static final Logger LOG = LogManager.getLogger(IndividualCheckRunner.class);
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final int maxThreads;
    private final int progressEvery;

    public IndividualCheckRunner(int maxThreads, int progressEvery) {
        this.maxThreads = Math.max(1, maxThreads);
        this.progressEvery = Math.max(1, progressEvery);
    }

    /**
     * Codes retained by the check, in input order.
     */
    public List<String> run(List<String> codes, EntityCheck check, ProgressListener listener)
            throws InterruptedException {
        int total = codes.size();
        if (total == 0) {
            return List.of();
        }
        String name = check.label();
        int threads = Math.min(maxThreads, total);
        ExecutorService pool = Executors.newFixedThreadPool(threads, workerFactory());
        CompletionService<FilterOutcome> completion = new ExecutorCompletionService<>(pool);
        Map<Future<FilterOutcome>, String> submitted = new HashMap<>(total * 2);
        for (String code : codes) {
            submitted.put(completion.submit(() -> check.evaluate(code)), code);
        }

        Set<String> retained = new HashSet<>();
        int skipped = 0;
        int failed = 0;
        try {
            for (int done = 1; done <= total; done++) {
                Future<FilterOutcome> future = completion.take();
                String code = submitted.get(future);
                FilterOutcome outcome;
                try {
                    outcome = future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.warn("check [{}] for {} failed: {}", name, code, cause.toString());
                    outcome = FilterOutcome.INDETERMINATE;
                }
                if (outcome == null) {
                    outcome = FilterOutcome.INDETERMINATE;
                }
                if (outcome == FilterOutcome.INDETERMINATE) {
                    skipped++;
                }
                if (retains(outcome)) {
                    retained.add(code);
                } else {
                    failed++;
                }
                if (done % progressEvery == 0 || done == total) {
                    listener.onProgress(new ProgressEvent(
                            name + ": checked " + done + "/" + total, name, total - done));
                }
            }
        } finally {
            pool.shutdownNow();
        }
        if (skipped > 0) {
            LOG.info("[{}] {} code(s) kept without a verdict (data unavailable), {} eliminated", name, skipped, failed);
        }

        List<String> out = new ArrayList<>(retained.size());
        for (String code : codes) {
            if (retained.contains(code)) {
                out.add(code);
            }
        }
        return out;
    }

    /**
     * The single place where a verdict turns into keep/drop.
     */
    static boolean retains(FilterOutcome outcome) {
        switch (outcome) {
            case PASS:
            case INDETERMINATE:
                return true;
            case FAIL:
                return false;
            default:
                throw new IllegalStateException("unhandled outcome: " + outcome);
        }
    }

    private static ThreadFactory workerFactory() {
        int poolNo = POOL_SEQ.incrementAndGet();
        AtomicInteger threadNo = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "screen-check-" + poolNo + "-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
