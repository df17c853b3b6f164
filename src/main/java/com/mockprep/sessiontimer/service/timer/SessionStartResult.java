package com.mockprep.sessiontimer.service.timer;

import lombok.Value;

import java.time.Instant;

@Value
public class SessionStartResult {
    Long sessionId;
    /** Start instant all elapsed computations use; the existing one when the session was already tracked. */
    Instant startTime;
    boolean alreadyTracked;
}
