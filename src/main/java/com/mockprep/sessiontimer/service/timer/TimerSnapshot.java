package com.mockprep.sessiontimer.service.timer;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TimerSnapshot {
    Long sessionId;
    boolean active;
    Long accountId;
    Instant startTime;
    long elapsedSeconds;
    long elapsedMinutes;
    Integer estimatedDurationMinutes;
    String jobTitle;
    Integer lastKnownBalance;

    public static TimerSnapshot inactive(Long sessionId) {
        return TimerSnapshot.builder()
                .sessionId(sessionId)
                .active(false)
                .build();
    }
}
