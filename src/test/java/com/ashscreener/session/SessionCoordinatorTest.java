package com.ashscreener.session;

import com.ashscreener.model.Criterion;
import com.ashscreener.model.ProgressEvent;
import com.ashscreener.model.ProgressSnapshot;
import com.ashscreener.model.ScreeningReport;
import com.ashscreener.model.SessionState;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionCoordinatorTest {

    @Test
    void idleCoordinatorShouldReportIdle() {
        SessionCoordinator sessions = new SessionCoordinator((c, l) -> report(0));

        ProgressSnapshot snapshot = sessions.getProgress();

        assertEquals(SessionState.IDLE, snapshot.state);
        assertFalse(snapshot.running);
        assertFalse(sessions.getResult("nope").isPresent());
        sessions.shutdown();
    }

    @Test
    void completedSessionShouldExposeResult() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        SessionCoordinator sessions = new SessionCoordinator((c, l) -> report(c.size()), executor);

        String token = sessions.startSession(EnumSet.of(Criterion.STATE_OWNED, Criterion.BUYBACK));
        drain(executor);

        ProgressSnapshot snapshot = sessions.getProgress();
        assertEquals(SessionState.COMPLETED, snapshot.state);
        assertEquals(token, snapshot.sessionId);
        assertEquals(2, sessions.getResult(token).get().finalCount);
    }

    @Test
    void supersededSessionShouldNotOverwriteNewerState() throws Exception {
        CountDownLatch releaseFirst = new CountDownLatch(1);
        CountDownLatch firstStarted = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        SessionCoordinator sessions = new SessionCoordinator((criteria, listener) -> {
            if (runs.incrementAndGet() == 1) {
                firstStarted.countDown();
                releaseFirst.await(5, TimeUnit.SECONDS);
                listener.onProgress(new ProgressEvent("stale progress", "stale", 99));
                return report(111);
            }
            return report(7);
        }, executor);

        String first = sessions.startSession(Set.of(Criterion.BUYBACK));
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
        String second = sessions.startSession(Set.of(Criterion.BUYBACK));
        awaitIdle(sessions);
        releaseFirst.countDown();
        drain(executor);

        assertNotEquals(first, second);
        ProgressSnapshot snapshot = sessions.getProgress();
        assertEquals(second, snapshot.sessionId);
        assertEquals(SessionState.COMPLETED, snapshot.state);
        assertNotEquals("stale", snapshot.stage);
        assertFalse(sessions.getResult(first).isPresent());
        assertEquals(7, sessions.getResult(second).get().finalCount);
    }

    @Test
    void failingSessionShouldRecordError() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        SessionCoordinator sessions = new SessionCoordinator((c, l) -> {
            throw new IllegalStateException("stock list unavailable");
        }, executor);

        String token = sessions.startSession(null);
        drain(executor);

        ProgressSnapshot snapshot = sessions.getProgress();
        assertEquals(SessionState.FAILED, snapshot.state);
        assertFalse(snapshot.running);
        assertTrue(snapshot.error.contains("stock list unavailable"));
        assertFalse(sessions.getResult(token).isPresent());
    }

    @Test
    void errorThrownByTaskShouldStillEndTheSession() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        SessionCoordinator sessions = new SessionCoordinator((c, l) -> {
            throw new NoClassDefFoundError("com/example/Missing");
        }, executor);

        String token = sessions.startSession(Set.of(Criterion.STATE_OWNED));
        drain(executor);

        ProgressSnapshot snapshot = sessions.getProgress();
        assertEquals(token, snapshot.sessionId);
        assertEquals(SessionState.FAILED, snapshot.state);
        assertFalse(snapshot.running);
        assertTrue(snapshot.error.contains("NoClassDefFoundError"));
    }

    @Test
    void sessionRejectedByExecutorShouldBeMarkedFailed() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        executor.shutdown();
        SessionCoordinator sessions = new SessionCoordinator((c, l) -> report(1), executor);

        String token = sessions.startSession(Set.of(Criterion.BUYBACK));

        ProgressSnapshot snapshot = sessions.getProgress();
        assertEquals(token, snapshot.sessionId);
        assertEquals(SessionState.FAILED, snapshot.state);
        assertFalse(snapshot.running);
        assertTrue(snapshot.error.startsWith("rejected"));
        assertFalse(sessions.getResult(token).isPresent());
    }

    @Test
    void progressEventsShouldReachTheSnapshotWhileRunning() throws Exception {
        CountDownLatch reported = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        SessionCoordinator sessions = new SessionCoordinator((c, listener) -> {
            listener.onProgress(new ProgressEvent("checked 20/40", "Dividend yield", 20));
            reported.countDown();
            finish.await(5, TimeUnit.SECONDS);
            return report(1);
        }, executor);

        sessions.startSession(Criterion.all());
        assertTrue(reported.await(5, TimeUnit.SECONDS));
        ProgressSnapshot running = sessions.getProgress();
        finish.countDown();
        drain(executor);

        assertTrue(running.running);
        assertEquals("Dividend yield", running.stage);
        assertEquals(20, running.remaining);
    }

    private static ScreeningReport report(int finalCount) {
        return new ScreeningReport(10, List.of(), List.of(), Map.of(), finalCount, List.of(), Map.of());
    }

    private static void drain(ExecutorService executor) throws InterruptedException {
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    private static void awaitIdle(SessionCoordinator sessions) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (sessions.getProgress().running && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }
}
