package com.mockprep.sessiontimer.service.timer;

import com.mockprep.sessiontimer.config.TimerProperties;
import com.mockprep.sessiontimer.store.ActiveSessionRecord;
import com.mockprep.sessiontimer.store.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Rebuilds the registry from sessions persisted as {@code active}. Elapsed time comes from the
 * stored start instant, so a restart loses at most the progress since the last checkpoint.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TimerRecoveryLoader {

    private final SessionStore sessionStore;
    private final TimerRegistry timerRegistry;
    private final TimerProperties properties;
    private final Clock clock;

    /**
     * @return number of sessions put back under tracking
     */
    public int recover() {
        List<ActiveSessionRecord> records = sessionStore.findActiveSessionsWithOwnerBalance();
        Instant now = clock.instant();
        int restored = 0;

        for (ActiveSessionRecord record : records) {
            if (record.getStartTime() == null) {
                continue;
            }
            TimerEntry entry = toEntry(record, now);
            if (timerRegistry.restore(entry)) {
                restored++;
                log.info("Loaded active session timer: {} ({}m elapsed, {}m persisted)",
                        record.getSessionId(), TimerEntry.toMinutes(entry.getElapsedSeconds()),
                        record.getDurationMinutes());
            }
        }
        return restored;
    }

    private TimerEntry toEntry(ActiveSessionRecord record, Instant now) {
        Integer estimate = record.getEstimatedMinutes();
        int estimatedMinutes = estimate != null && estimate > 0 ? estimate : properties.getDefaultEstimatedMinutes();

        TimerEntry entry = new TimerEntry(record.getSessionId(), record.getAccountId(), record.getStartTime(),
                record.getJobTitle(), estimatedMinutes, 0, record.getBalance(), now);

        // The persisted duration is the last checkpoint that reached the store. Without one,
        // everything up to the current minute is treated as already flushed.
        Integer persisted = record.getDurationMinutes();
        entry.advanceCheckpoint(persisted != null ? persisted : TimerEntry.toMinutes(entry.getElapsedSeconds()));
        return entry;
    }
}
