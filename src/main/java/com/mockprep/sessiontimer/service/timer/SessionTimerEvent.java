package com.mockprep.sessiontimer.service.timer;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
public class SessionTimerEvent {

    public enum Type {
        BACKGROUND_TIMER_STARTED,
        BACKGROUND_TIMER_STOPPED,
        SESSION_DURATION_WARNING,
        SESSION_AUTO_STOPPED
    }

    Type type;
    Long sessionId;
    Long accountId;
    Instant timestamp;
    Map<String, Object> details;
}
