package com.mockprep.sessiontimer.service.timer;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TimerStats {
    boolean running;
    int activeTimers;
    long totalElapsedMinutes;
    LongestSession longestSession;

    @Value
    public static class LongestSession {
        Long sessionId;
        long elapsedMinutes;
        String jobTitle;
    }
}
