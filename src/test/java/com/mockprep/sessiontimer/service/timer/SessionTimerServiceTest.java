package com.mockprep.sessiontimer.service.timer;

import com.mockprep.sessiontimer.model.InterviewSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SessionTimerServiceTest {

    private TimerEngineFixture fx;
    private SessionTimerService service;

    @BeforeEach
    void setUp() {
        fx = new TimerEngineFixture();
        service = fx.service;
        fx.ledger.setBalance(7L, 3);
    }

    // ========== Recovery ==========

    @Test
    @DisplayName("recovered session 37 minutes in with 36 persisted is checkpointed to 37")
    void recoveryResumesFromPersistedDuration() {
        fx.store.add(1L, 7L, InterviewSession.STATUS_ACTIVE, TimerEngineFixture.T0.minus(Duration.ofMinutes(37)), 36);

        service.initialize();
        fx.loop.reconcile();

        assertEquals(37, fx.store.row(1L).durationMinutes);
        assertEquals(List.of(37), fx.store.durationWrites(1L));
        assertEquals(37, fx.entry(1L).getLastCheckpointMinute());
        verify(fx.scheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    @Test
    void recoverySkipsSessionsThatAreNotRunning() {
        fx.store.add(1L, 7L, InterviewSession.STATUS_ACTIVE, TimerEngineFixture.T0.minus(Duration.ofMinutes(5)), 5);
        fx.store.add(2L, 7L, InterviewSession.STATUS_ACTIVE, null, 0);
        fx.store.add(3L, 7L, InterviewSession.STATUS_COMPLETED, TimerEngineFixture.T0.minus(Duration.ofMinutes(9)), 9);
        fx.store.add(4L, 7L, InterviewSession.STATUS_CREATED, null, 0);

        assertEquals(1, fx.recoveryLoader.recover());
        assertEquals(0, fx.recoveryLoader.recover(), "recovering twice keeps existing entries");

        TimerEntry entry = fx.entry(1L);
        assertEquals(300, entry.getElapsedSeconds());
        assertEquals(60, entry.getEstimatedDurationMinutes());
        assertEquals(3, entry.getLastKnownBalance());
        assertEquals(1, fx.registry.size());
    }

    @Test
    void recoveryWithoutPersistedDurationTreatsCurrentMinuteAsFlushed() {
        fx.store.add(1L, 7L, InterviewSession.STATUS_ACTIVE, TimerEngineFixture.T0.minus(Duration.ofSeconds(610)), null);

        fx.recoveryLoader.recover();
        fx.loop.reconcile();

        assertEquals(10, fx.entry(1L).getLastCheckpointMinute());
        assertTrue(fx.store.durationWrites(1L).isEmpty());
    }

    @Test
    void disabledEngineNeitherRecoversNorSchedules() {
        fx.properties.setEnabled(false);
        fx.store.add(1L, 7L, InterviewSession.STATUS_ACTIVE, TimerEngineFixture.T0, 0);

        service.initialize();

        assertEquals(0, fx.registry.size());
        assertFalse(fx.loop.isRunning());
        verify(fx.scheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
    }

    // ========== Start / status ==========

    @Test
    void sessionStartUsesDefaultEstimateAndReturnsStartInstant() {
        SessionStartResult result = service.handleSessionStart(1L, 7L, null, "QA Engineer");

        assertEquals(TimerEngineFixture.T0, result.getStartTime());
        TimerSnapshot status = service.getTimerStatus(1L);
        assertTrue(status.isActive());
        assertEquals(60, status.getEstimatedDurationMinutes());
        assertEquals("QA Engineer", status.getJobTitle());
    }

    @Test
    void unknownSessionStatusIsInactive() {
        TimerSnapshot status = service.getTimerStatus(42L);

        assertFalse(status.isActive());
        assertEquals(42L, status.getSessionId());
    }

    // ========== Manual stop ==========

    @Test
    void manualStopCompletesOwnedActiveSession() {
        fx.store.add(1L, 7L, InterviewSession.STATUS_ACTIVE, TimerEngineFixture.T0, 0);
        service.handleSessionStart(1L, 7L, 45, null);
        fx.clock.advance(Duration.ofSeconds(310));

        ManualStopResult result = service.handleManualStop(1L, 7L, "Interview finished early");

        assertEquals(5, result.getElapsedMinutes());
        assertEquals(310, result.getElapsedSeconds());
        assertEquals(fx.clock.instant(), result.getStoppedAt());
        assertEquals(InterviewSession.STATUS_COMPLETED, fx.store.row(1L).status);
        assertEquals(5, fx.store.row(1L).durationMinutes);
        assertEquals("\n[2025-01-06T10:05:10Z] Session manually stopped: Interview finished early", fx.store.row(1L).notes);
        assertFalse(service.getTimerStatus(1L).isActive());
    }

    @Test
    void manualStopByAnotherAccountIsDenied() {
        fx.store.add(1L, 7L, InterviewSession.STATUS_ACTIVE, TimerEngineFixture.T0, 0);
        service.handleSessionStart(1L, 7L, 45, null);

        TimerOperationException e = assertThrows(TimerOperationException.class,
                () -> service.handleManualStop(1L, 8L, null));

        assertEquals(TimerOperationException.Reason.ACCESS_DENIED, e.getReason());
        assertNotNull(fx.entry(1L));
        assertEquals(InterviewSession.STATUS_ACTIVE, fx.store.row(1L).status);
    }

    @Test
    void manualStopOfInactiveSessionIsRejected() {
        fx.store.add(1L, 7L, InterviewSession.STATUS_COMPLETED, TimerEngineFixture.T0, 12);
        service.handleSessionStart(1L, 7L, 45, null);

        TimerOperationException e = assertThrows(TimerOperationException.class,
                () -> service.handleManualStop(1L, 7L, null));

        assertEquals(TimerOperationException.Reason.NOT_ACTIVE, e.getReason());
        assertNotNull(fx.entry(1L));
    }

    @Test
    void manualStopOfUnknownOrUntrackedSessionIsNotFound() {
        TimerOperationException unknown = assertThrows(TimerOperationException.class,
                () -> service.handleManualStop(1L, 7L, null));
        assertEquals(TimerOperationException.Reason.NOT_FOUND, unknown.getReason());

        fx.store.add(2L, 7L, InterviewSession.STATUS_ACTIVE, TimerEngineFixture.T0, 0);
        TimerOperationException untracked = assertThrows(TimerOperationException.class,
                () -> service.handleManualStop(2L, 7L, null));
        assertEquals(TimerOperationException.Reason.NOT_FOUND, untracked.getReason());
        assertEquals(InterviewSession.STATUS_ACTIVE, fx.store.row(2L).status);
    }

    @RepeatedTest(25)
    @DisplayName("manual stop racing a credit stop terminates the session exactly once")
    void concurrentStopsTerminateOnce() throws Exception {
        fx.ledger.setBalance(7L, -1);
        fx.store.add(1L, 7L, InterviewSession.STATUS_ACTIVE, TimerEngineFixture.T0, 0);
        service.handleSessionStart(1L, 7L, 45, null);
        fx.clock.advance(Duration.ofMinutes(5));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            Future<Optional<ManualStopResult>> manual = pool.submit(() -> {
                go.await();
                try {
                    return Optional.of(service.handleManualStop(1L, 7L, "user"));
                } catch (TimerOperationException e) {
                    return Optional.empty();
                }
            });
            Future<?> tick = pool.submit(() -> {
                go.await();
                fx.loop.reconcile();
                return null;
            });
            go.countDown();

            Optional<ManualStopResult> manualResult = manual.get(5, TimeUnit.SECONDS);
            tick.get(5, TimeUnit.SECONDS);

            int autoStops = fx.events(SessionTimerEvent.Type.SESSION_AUTO_STOPPED).size();
            assertEquals(1, fx.store.completions());
            assertEquals(1, fx.events(SessionTimerEvent.Type.BACKGROUND_TIMER_STOPPED).size());
            assertEquals(1, autoStops + (manualResult.isPresent() ? 1 : 0));
            assertEquals(0, fx.registry.size());
        } finally {
            pool.shutdownNow();
        }
    }

    // ========== External end ==========

    @Test
    void sessionEndStopsTrackingOnce() {
        service.handleSessionStart(1L, 7L, 45, null);
        fx.clock.advance(Duration.ofMinutes(3));

        Optional<StopResult> ended = service.handleSessionEnd(1L, null);

        assertEquals(3, ended.orElseThrow().getElapsedMinutes());
        assertTrue(service.handleSessionEnd(1L, null).isEmpty());
    }

    // ========== Stats / shutdown ==========

    @Test
    void statsReportTotalsAndLongestSession() {
        fx.registry.start(1L, 7L, TimerEngineFixture.T0.minus(Duration.ofMinutes(12)), 45, "Frontend Engineer");
        fx.registry.start(2L, 7L, TimerEngineFixture.T0.minus(Duration.ofMinutes(50)), 45, "Staff Engineer");
        fx.registry.start(3L, 8L, TimerEngineFixture.T0.minus(Duration.ofSeconds(30)), 45, null);

        TimerStats stats = service.getStats();

        assertFalse(stats.isRunning());
        assertEquals(3, stats.getActiveTimers());
        assertEquals(62, stats.getTotalElapsedMinutes());
        assertEquals(2L, stats.getLongestSession().getSessionId());
        assertEquals("Staff Engineer", stats.getLongestSession().getJobTitle());
    }

    @Test
    void statsWithNoTimersHaveNoLongestSession() {
        TimerStats stats = service.getStats();

        assertEquals(0, stats.getActiveTimers());
        assertNull(stats.getLongestSession());
    }

    @Test
    @DisplayName("shutdown flushes 10m05s, 0m40s and 61m00s as 10, 0 and 61 minutes")
    void shutdownFlushesEveryTimer() {
        Instant now = TimerEngineFixture.T0;
        fx.store.add(1L, 7L, InterviewSession.STATUS_ACTIVE, now.minusSeconds(605), 9);
        fx.store.add(2L, 7L, InterviewSession.STATUS_ACTIVE, now.minusSeconds(40), 0);
        fx.store.add(3L, 7L, InterviewSession.STATUS_ACTIVE, now.minusSeconds(3660), 60);
        fx.registry.start(1L, 7L, now.minusSeconds(605), 45, null);
        fx.registry.start(2L, 7L, now.minusSeconds(40), 45, null);
        fx.registry.start(3L, 7L, now.minusSeconds(3660), 45, null);

        service.shutdown();

        assertEquals(10, fx.store.row(1L).durationMinutes);
        assertEquals(0, fx.store.row(2L).durationMinutes);
        assertEquals(61, fx.store.row(3L).durationMinutes);
        assertEquals(0, fx.registry.size());
        assertFalse(fx.loop.isRunning());
    }

    @Test
    void shutdownContinuesPastAFailedFlush() {
        fx.store.add(1L, 7L, InterviewSession.STATUS_ACTIVE, TimerEngineFixture.T0.minusSeconds(120), 0);
        fx.store.add(2L, 7L, InterviewSession.STATUS_ACTIVE, TimerEngineFixture.T0.minusSeconds(180), 0);
        fx.registry.start(1L, 7L, TimerEngineFixture.T0.minusSeconds(120), 45, null);
        fx.registry.start(2L, 7L, TimerEngineFixture.T0.minusSeconds(180), 45, null);
        fx.store.failOn(1L);

        service.shutdown();

        assertEquals(3, fx.store.row(2L).durationMinutes);
        assertEquals(0, fx.registry.size());
    }
}
