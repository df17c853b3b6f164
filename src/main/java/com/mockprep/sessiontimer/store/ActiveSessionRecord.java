package com.mockprep.sessiontimer.store;

import lombok.Value;

import java.time.Instant;

/**
 * An {@code active} session as seen by the recovery scan, joined with its owner's balance.
 */
@Value
public class ActiveSessionRecord {
    Long sessionId;
    Long accountId;
    Instant startTime;
    Integer durationMinutes;
    Integer estimatedMinutes;
    String jobTitle;
    Integer balance;
}
