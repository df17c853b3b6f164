package com.mockprep.sessiontimer.service.timer;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * In-memory tracking state of one active session. Owned by {@link TimerRegistry}; mutated only
 * while the registry lock is held.
 */
@Getter
@ToString
public class TimerEntry {

    private final Long sessionId;
    private final Long accountId;
    private final Instant startTime;
    private final String jobTitle;

    private long elapsedSeconds;
    private long lastCheckpointMinute;
    private int estimatedDurationMinutes;
    private Instant lastCreditCheck;
    private Integer lastKnownBalance;

    TimerEntry(Long sessionId, Long accountId, Instant startTime, String jobTitle,
               int estimatedDurationMinutes, long lastCheckpointMinute,
               Integer lastKnownBalance, Instant now) {
        this.sessionId = sessionId;
        this.accountId = accountId;
        this.startTime = startTime;
        this.jobTitle = jobTitle;
        this.estimatedDurationMinutes = estimatedDurationMinutes;
        this.lastCheckpointMinute = lastCheckpointMinute;
        this.lastKnownBalance = lastKnownBalance;
        this.lastCreditCheck = now;
        this.elapsedSeconds = elapsedSecondsAt(now);
    }

    long elapsedSecondsAt(Instant now) {
        return Math.max(0, Duration.between(startTime, now).getSeconds());
    }

    static long toMinutes(long seconds) {
        return seconds / 60;
    }

    void recordElapsed(long seconds) {
        this.elapsedSeconds = seconds;
    }

    // never moves backwards
    void advanceCheckpoint(long minute) {
        if (minute > lastCheckpointMinute) {
            lastCheckpointMinute = minute;
        }
    }

    void markCreditChecked(Instant at) {
        if (lastCreditCheck == null || at.isAfter(lastCreditCheck)) {
            lastCreditCheck = at;
        }
    }

    void enlargeEstimate(int minutes) {
        if (minutes > estimatedDurationMinutes) {
            estimatedDurationMinutes = minutes;
        }
    }

    void updateKnownBalance(Integer balance) {
        this.lastKnownBalance = balance;
    }

    TimerSnapshot snapshotAt(Instant now) {
        long seconds = elapsedSecondsAt(now);
        return TimerSnapshot.builder()
                .sessionId(sessionId)
                .active(true)
                .accountId(accountId)
                .startTime(startTime)
                .elapsedSeconds(seconds)
                .elapsedMinutes(toMinutes(seconds))
                .estimatedDurationMinutes(estimatedDurationMinutes)
                .jobTitle(jobTitle)
                .lastKnownBalance(lastKnownBalance)
                .build();
    }
}
