package com.mockprep.sessiontimer.service.timer;

import lombok.Value;

/**
 * Elapsed time measured at the moment a timer was removed from the registry.
 */
@Value
public class StopResult {
    Long sessionId;
    long elapsedSeconds;
    long elapsedMinutes;
}
