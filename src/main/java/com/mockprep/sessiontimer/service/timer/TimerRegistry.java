package com.mockprep.sessiontimer.service.timer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Authoritative in-memory map from session id to {@link TimerEntry}.
 * <p>
 * All reads and mutations go through one lock, shared with the reconciliation loop, so a
 * lifecycle call and a tick never interleave on the same entry. Removal from the map is the
 * point where a manual stop and a credit stop race: whoever removes the entry terminates the
 * session, the other sees it absent.
 */
@Component
@Slf4j
public class TimerRegistry {

    private final Map<Long, TimerEntry> timers = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;

    public TimerRegistry(Clock clock, ApplicationEventPublisher eventPublisher) {
        this.clock = clock;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Starts tracking a session. A second start for a tracked session is logged and ignored;
     * the result then carries the start instant already in use.
     */
    public SessionStartResult start(Long sessionId, Long accountId, Instant startTime,
                                    int estimatedMinutes, String jobTitle) {
        return exclusive(() -> {
            TimerEntry existing = timers.get(sessionId);
            if (existing != null) {
                log.warn("Timer already exists for session: {}", sessionId);
                return new SessionStartResult(sessionId, existing.getStartTime(), true);
            }

            Instant now = clock.instant();
            timers.put(sessionId, new TimerEntry(sessionId, accountId, startTime, jobTitle,
                    estimatedMinutes, 0, null, now));
            log.info("Started background timer for session: {}", sessionId);

            publish(SessionTimerEvent.Type.BACKGROUND_TIMER_STARTED, sessionId, accountId, now, Map.of(
                    "startTime", startTime,
                    "estimatedDuration", estimatedMinutes));
            return new SessionStartResult(sessionId, startTime, false);
        });
    }

    /**
     * Seeds an entry reconstructed from the session store. Returns false if the session is
     * already tracked.
     */
    boolean restore(TimerEntry entry) {
        return exclusive(() -> timers.putIfAbsent(entry.getSessionId(), entry) == null);
    }

    /**
     * Removes the timer and reports elapsed time measured now.
     */
    public Optional<StopResult> stop(Long sessionId, String reason) {
        return exclusive(() -> {
            TimerEntry entry = timers.remove(sessionId);
            if (entry == null) {
                log.info("No active timer found for session: {}", sessionId);
                return Optional.empty();
            }

            Instant now = clock.instant();
            long elapsedSeconds = entry.elapsedSecondsAt(now);
            long elapsedMinutes = TimerEntry.toMinutes(elapsedSeconds);
            log.info("Stopped background timer for session: {} ({}m elapsed, reason: {})",
                    sessionId, elapsedMinutes, reason);

            publish(SessionTimerEvent.Type.BACKGROUND_TIMER_STOPPED, sessionId, entry.getAccountId(), now, Map.of(
                    "elapsedMinutes", elapsedMinutes,
                    "elapsedSeconds", elapsedSeconds,
                    "reason", Objects.requireNonNullElse(reason, "unspecified")));
            return Optional.of(new StopResult(sessionId, elapsedSeconds, elapsedMinutes));
        });
    }

    public Optional<TimerSnapshot> query(Long sessionId) {
        return exclusive(() -> {
            TimerEntry entry = timers.get(sessionId);
            return entry == null ? Optional.<TimerSnapshot>empty() : Optional.of(entry.snapshotAt(clock.instant()));
        });
    }

    public List<TimerSnapshot> listAll() {
        return exclusive(() -> {
            Instant now = clock.instant();
            List<TimerSnapshot> snapshots = new ArrayList<>(timers.size());
            for (TimerEntry entry : timers.values()) {
                snapshots.add(entry.snapshotAt(now));
            }
            return snapshots;
        });
    }

    public int size() {
        return exclusive(timers::size);
    }

    List<Long> sessionIds() {
        return exclusive(() -> new ArrayList<>(timers.keySet()));
    }

    /** Caller must hold the lock. */
    TimerEntry find(Long sessionId) {
        return timers.get(sessionId);
    }

    /** Drops an entry without reporting elapsed time. Caller must hold the lock. */
    void discard(Long sessionId) {
        timers.remove(sessionId);
    }

    /**
     * Removes and returns every entry.
     */
    List<TimerEntry> drain() {
        return exclusive(() -> {
            List<TimerEntry> drained = new ArrayList<>(timers.values());
            timers.clear();
            return drained;
        });
    }

    <T> T exclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    void publish(SessionTimerEvent.Type type, Long sessionId, Long accountId, Instant at, Map<String, Object> details) {
        eventPublisher.publishEvent(new SessionTimerEvent(type, sessionId, accountId, at, details));
    }
}
