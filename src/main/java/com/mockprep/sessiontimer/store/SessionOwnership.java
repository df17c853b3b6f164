package com.mockprep.sessiontimer.store;

import lombok.Value;

@Value
public class SessionOwnership {
    Long sessionId;
    Long accountId;
    String status;
}
