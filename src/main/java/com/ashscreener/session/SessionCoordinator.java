package com.ashscreener.session;

import com.ashscreener.model.Criterion;
import com.ashscreener.model.ProgressEvent;
import com.ashscreener.model.ProgressSnapshot;
import com.ashscreener.model.ScreeningReport;
import com.ashscreener.model.SessionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.SecureRandom;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 模块说明：SessionCoordinator（class）。
 * 主要职责：管理筛选会话；同一时刻只有一个"当前"会话，新会话启动后旧会话即被取代。
 * 使用建议：被取代的会话仍会在后台跑完，但它的进度、结果与错误写入全部丢弃。
 */
public final class SessionCoordinator {
    private static final Logger LOG = LogManager.getLogger(SessionCoordinator.class);
    private static final char[] TOKEN_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final ScreeningTask task;
    private final ExecutorService executor;
    private final SecureRandom random = new SecureRandom();
    private final ReentrantLock lock = new ReentrantLock();

    private long sequence;
    private String currentToken;
    private ProgressSnapshot progress = ProgressSnapshot.idle();
    private final Map<String, ScreeningReport> results = new HashMap<>();

    public SessionCoordinator(ScreeningTask task) {
        this(task, defaultExecutor());
    }

    public SessionCoordinator(ScreeningTask task, ExecutorService executor) {
        this.task = task;
        this.executor = executor;
    }

    public String startSession(Set<Criterion> criteria) {
        Set<Criterion> selected = criteria == null || criteria.isEmpty()
                ? Criterion.all()
                : EnumSet.copyOf(criteria);
        String token;
        lock.lock();
        try {
            sequence++;
            token = newToken(sequence);
            if (currentToken != null) {
                LOG.info("session {} superseded by {}", currentToken, token);
            }
            currentToken = token;
            // only the current session's result is ever readable
            results.clear();
            progress = ProgressSnapshot.builder()
                    .sessionId(token)
                    .state(SessionState.RUNNING)
                    .running(true)
                    .stage(ProgressEvent.STAGE_INIT)
                    .message("Starting")
                    .remaining(0)
                    .error(null)
                    .build();
        } finally {
            lock.unlock();
        }
        final String sessionToken = token;
        try {
            executor.submit(() -> execute(sessionToken, selected));
        } catch (RejectedExecutionException e) {
            LOG.error("session {} could not be scheduled: {}", token, e.getMessage());
            fail(token, "rejected: " + e.getMessage());
        }
        return token;
    }

    public ProgressSnapshot getProgress() {
        lock.lock();
        try {
            return progress;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ScreeningReport> getResult(String token) {
        if (token == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            if (!token.equals(currentToken)) {
                return Optional.empty();
            }
            return Optional.ofNullable(results.get(token));
        } finally {
            lock.unlock();
        }
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    private void execute(String token, Set<Criterion> criteria) {
        try {
            ScreeningReport report = task.run(criteria, event -> onProgress(token, event));
            lock.lock();
            try {
                if (!token.equals(currentToken)) {
                    LOG.info("session {} finished after being superseded, result dropped", token);
                    return;
                }
                results.put(token, report);
                progress = progress.toBuilder()
                        .state(SessionState.COMPLETED)
                        .running(false)
                        .stage(ProgressEvent.STAGE_DONE)
                        .message("Completed: " + report.finalCount + " passed")
                        .remaining(0)
                        .build();
            } finally {
                lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(token, "interrupted");
        } catch (Exception e) {
            LOG.error("session {} failed", token, e);
            fail(token, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (Error e) {
            LOG.error("session {} aborted", token, e);
            fail(token, e.getClass().getSimpleName() + ": " + e.getMessage());
            throw e;
        }
    }

    private void onProgress(String token, ProgressEvent event) {
        if (event == null) {
            return;
        }
        lock.lock();
        try {
            if (!token.equals(currentToken) || !progress.running) {
                return;
            }
            progress = progress.toBuilder()
                    .stage(event.stage)
                    .message(event.message)
                    .remaining(event.remaining)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    private void fail(String token, String error) {
        lock.lock();
        try {
            if (!token.equals(currentToken)) {
                return;
            }
            progress = progress.toBuilder()
                    .state(SessionState.FAILED)
                    .running(false)
                    .message("Failed")
                    .error(error)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    private String newToken(long seq) {
        StringBuilder sb = new StringBuilder(Long.toString(seq, 36)).append('-');
        for (int i = 0; i < 6; i++) {
            sb.append(TOKEN_CHARS[random.nextInt(TOKEN_CHARS.length)]);
        }
        return sb.toString();
    }

    private static ExecutorService defaultExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "screen-session-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
