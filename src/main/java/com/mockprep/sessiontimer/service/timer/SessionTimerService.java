package com.mockprep.sessiontimer.service.timer;

import com.mockprep.sessiontimer.config.TimerProperties;
import com.mockprep.sessiontimer.model.InterviewSession;
import com.mockprep.sessiontimer.store.SessionOwnership;
import com.mockprep.sessiontimer.store.SessionStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lifecycle operations used by the request-handling layer, plus engine startup and shutdown.
 * <p>
 * Tracking runs independently of any client connection: once started, a session keeps being
 * checkpointed and credit-checked until it is stopped manually, stopped for lack of credits,
 * ended externally, or the process shuts down.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionTimerService {

    static final String DEFAULT_MANUAL_STOP_REASON = "Manual stop from web app";
    static final String DEFAULT_END_REASON = "External completion";

    private final TimerRegistry timerRegistry;
    private final TimerRecoveryLoader recoveryLoader;
    private final ReconciliationLoop reconciliationLoop;
    private final SessionStore sessionStore;
    private final TimerProperties properties;
    private final Clock clock;

    @PostConstruct
    public void initialize() {
        if (!properties.isEnabled()) {
            log.info("Background timer service disabled");
            return;
        }
        try {
            recoveryLoader.recover();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to initialize background timer service", e);
        }
        reconciliationLoop.start();
        log.info("Background timer service initialized, managing {} active session timers", timerRegistry.size());
    }

    public SessionStartResult handleSessionStart(Long sessionId, Long accountId,
                                                 Integer estimatedDuration, String jobTitle) {
        int estimate = estimatedDuration != null && estimatedDuration > 0
                ? estimatedDuration
                : properties.getDefaultEstimatedMinutes();
        log.info("Starting background timer for session: {}", sessionId);
        return timerRegistry.start(sessionId, accountId, clock.instant(), estimate, jobTitle);
    }

    /**
     * Stops a session on behalf of its owner. Ownership and status are re-read from the store at
     * call time; nothing is mutated unless both checks pass.
     *
     * @throws TimerOperationException NOT_FOUND, ACCESS_DENIED or NOT_ACTIVE
     */
    public ManualStopResult handleManualStop(Long sessionId, Long accountId, String reason) {
        String stopReason = Objects.requireNonNullElse(reason, DEFAULT_MANUAL_STOP_REASON);

        SessionOwnership ownership = sessionStore.findOwnership(sessionId)
                .orElseThrow(() -> rejected(TimerOperationException.Reason.NOT_FOUND, sessionId,
                        "Session not found"));
        if (!ownership.getAccountId().equals(accountId)) {
            throw rejected(TimerOperationException.Reason.ACCESS_DENIED, sessionId,
                    "Session does not belong to account " + accountId);
        }
        if (!InterviewSession.STATUS_ACTIVE.equals(ownership.getStatus())) {
            throw rejected(TimerOperationException.Reason.NOT_ACTIVE, sessionId,
                    "Cannot stop session with status: " + ownership.getStatus());
        }

        StopResult stopped = timerRegistry.stop(sessionId, stopReason)
                .orElseThrow(() -> rejected(TimerOperationException.Reason.NOT_FOUND, sessionId,
                        "No active timer found for session"));

        Instant stoppedAt = clock.instant();
        sessionStore.completeSession(sessionId, (int) stopped.getElapsedMinutes(),
                "\n[" + stoppedAt + "] Session manually stopped: " + stopReason);

        return ManualStopResult.builder()
                .sessionId(sessionId)
                .elapsedMinutes(stopped.getElapsedMinutes())
                .elapsedSeconds(stopped.getElapsedSeconds())
                .stoppedAt(stoppedAt)
                .build();
    }

    /**
     * Stops tracking a session whose own state machine concluded. The session record is left to
     * that caller.
     */
    public Optional<StopResult> handleSessionEnd(Long sessionId, String reason) {
        return timerRegistry.stop(sessionId, Objects.requireNonNullElse(reason, DEFAULT_END_REASON));
    }

    public TimerSnapshot getTimerStatus(Long sessionId) {
        return timerRegistry.query(sessionId).orElseGet(() -> TimerSnapshot.inactive(sessionId));
    }

    public List<TimerSnapshot> getAllActiveTimers() {
        return timerRegistry.listAll();
    }

    public TimerStats getStats() {
        List<TimerSnapshot> timers = timerRegistry.listAll();
        long totalMinutes = 0;
        TimerSnapshot longest = null;

        for (TimerSnapshot timer : timers) {
            totalMinutes += timer.getElapsedMinutes();
            if (longest == null || timer.getElapsedMinutes() > longest.getElapsedMinutes()) {
                longest = timer;
            }
        }

        return TimerStats.builder()
                .running(reconciliationLoop.isRunning())
                .activeTimers(timers.size())
                .totalElapsedMinutes(totalMinutes)
                .longestSession(longest == null ? null : new TimerStats.LongestSession(
                        longest.getSessionId(), longest.getElapsedMinutes(), longest.getJobTitle()))
                .build();
    }

    /**
     * Stops the loop, then writes each tracked session's best-known minutes and empties the
     * registry.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down background timer service...");
        reconciliationLoop.stop();

        Instant now = clock.instant();
        for (TimerEntry entry : timerRegistry.drain()) {
            long minutes = Math.max(TimerEntry.toMinutes(entry.elapsedSecondsAt(now)), entry.getLastCheckpointMinute());
            try {
                sessionStore.updateDuration(entry.getSessionId(), (int) minutes);
                log.info("Saved final timer state for session {}: {}m", entry.getSessionId(), minutes);
            } catch (RuntimeException e) {
                log.error("Failed to save timer state for session {}", entry.getSessionId(), e);
            }
        }
        log.info("Background timer service shutdown complete");
    }

    private TimerOperationException rejected(TimerOperationException.Reason reason, Long sessionId, String message) {
        log.warn("Rejected stop for session {}: {}", sessionId, message);
        return new TimerOperationException(reason, sessionId, message);
    }
}
