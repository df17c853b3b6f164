package com.mockprep.sessiontimer.service.timer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class SessionEventLogger {

    @EventListener
    public void onSessionEvent(SessionTimerEvent event) {
        if (event.getType() == SessionTimerEvent.Type.SESSION_DURATION_WARNING) {
            log.warn("Session Event {} session={} user={} at={} {}",
                    event.getType(), event.getSessionId(), event.getAccountId(), event.getTimestamp(), event.getDetails());
        } else {
            log.info("Session Event {} session={} user={} at={} {}",
                    event.getType(), event.getSessionId(), event.getAccountId(), event.getTimestamp(), event.getDetails());
        }
    }
}
