package com.mockprep.sessiontimer.service.timer;

import com.mockprep.sessiontimer.config.TimerProperties;
import com.mockprep.sessiontimer.store.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * One shared periodic tick over every tracked session: checkpoint the duration at minute
 * boundaries, check credits at a coarser interval, warn on overrun.
 * <p>
 * Each entry is processed under the registry lock. A failure on one entry drops that entry and
 * never aborts the tick for the others.
 */
@Component
@Slf4j
public class ReconciliationLoop {

    private final TimerRegistry timerRegistry;
    private final SessionStore sessionStore;
    private final CreditEnforcer creditEnforcer;
    private final TimerProperties properties;
    private final Clock clock;
    private final TaskScheduler taskScheduler;

    private ScheduledFuture<?> scheduledTick;
    private volatile boolean running;

    public ReconciliationLoop(TimerRegistry timerRegistry,
                              SessionStore sessionStore,
                              CreditEnforcer creditEnforcer,
                              TimerProperties properties,
                              Clock clock,
                              TaskScheduler taskScheduler) {
        this.timerRegistry = timerRegistry;
        this.sessionStore = sessionStore;
        this.creditEnforcer = creditEnforcer;
        this.properties = properties;
        this.clock = clock;
        this.taskScheduler = taskScheduler;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Timer loop already running");
            return;
        }
        Duration interval = properties.getTickInterval();
        Instant firstTick = clock.instant().plus(properties.getInitialDelay());
        scheduledTick = taskScheduler.scheduleAtFixedRate(this::reconcile, firstTick, interval);
        running = true;
        log.info("Starting background timer loop ({}s intervals)", interval.toSeconds());
    }

    public synchronized void stop() {
        if (scheduledTick != null) {
            scheduledTick.cancel(false);
            scheduledTick = null;
        }
        running = false;
        log.info("Background timer loop stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Runs one reconciliation tick across the whole registry.
     */
    public void reconcile() {
        List<Long> sessionIds = timerRegistry.sessionIds();
        if (sessionIds.isEmpty()) {
            return;
        }

        log.debug("Processing {} active session timers...", sessionIds.size());
        Instant now = clock.instant();

        for (Long sessionId : sessionIds) {
            timerRegistry.exclusive(() -> {
                TimerEntry entry = timerRegistry.find(sessionId);
                if (entry == null) {
                    // stopped since the id list was taken
                    return null;
                }
                try {
                    processEntry(entry, now);
                } catch (RuntimeException e) {
                    log.error("Removing problematic timer for session: {}", sessionId, e);
                    timerRegistry.discard(sessionId);
                }
                return null;
            });
        }
    }

    private void processEntry(TimerEntry entry, Instant now) {
        Long sessionId = entry.getSessionId();
        long elapsedSeconds = entry.elapsedSecondsAt(now);
        long currentMinute = TimerEntry.toMinutes(elapsedSeconds);
        entry.recordElapsed(elapsedSeconds);

        if (currentMinute > entry.getLastCheckpointMinute()) {
            int rows = sessionStore.updateDuration(sessionId, (int) currentMinute);
            entry.advanceCheckpoint(currentMinute);
            log.debug("Updated session {}: {}m elapsed ({} row)", sessionId, currentMinute, rows);
        }

        if (Duration.between(entry.getLastCreditCheck(), now).compareTo(properties.getCreditCheckInterval()) >= 0) {
            boolean terminated = creditEnforcer.enforce(entry);
            entry.markCreditChecked(now);
            if (terminated) {
                return;
            }
        }

        double maxAllowedMinutes = entry.getEstimatedDurationMinutes() * properties.getOverrunFactor();
        if (currentMinute >= maxAllowedMinutes) {
            warnOverrun(entry, currentMinute, maxAllowedMinutes, now);
        }
    }

    private void warnOverrun(TimerEntry entry, long currentMinute, double maxAllowedMinutes, Instant now) {
        int estimate = entry.getEstimatedDurationMinutes();
        log.warn("Session {} has exceeded estimated duration: {}m / {}m allowed",
                entry.getSessionId(), currentMinute, maxAllowedMinutes);

        timerRegistry.publish(SessionTimerEvent.Type.SESSION_DURATION_WARNING, entry.getSessionId(),
                entry.getAccountId(), now, Map.of(
                        "elapsedMinutes", currentMinute,
                        "estimatedDuration", estimate,
                        "maxAllowedMinutes", maxAllowedMinutes));

        long enlarged = Math.max(estimate * 2L, currentMinute + properties.getOverrunExtensionMinutes());
        entry.enlargeEstimate((int) Math.min(enlarged, Integer.MAX_VALUE));
    }
}
