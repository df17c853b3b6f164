package com.mockprep.sessiontimer.service.timer;

import lombok.Getter;

@Getter
public class TimerOperationException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        ACCESS_DENIED,
        NOT_ACTIVE
    }

    private final Reason reason;
    private final Long sessionId;

    public TimerOperationException(Reason reason, Long sessionId, String message) {
        super(message);
        this.reason = reason;
        this.sessionId = sessionId;
    }
}
