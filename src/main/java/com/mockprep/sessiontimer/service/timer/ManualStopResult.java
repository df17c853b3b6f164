package com.mockprep.sessiontimer.service.timer;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ManualStopResult {
    Long sessionId;
    long elapsedMinutes;
    long elapsedSeconds;
    Instant stoppedAt;
}
