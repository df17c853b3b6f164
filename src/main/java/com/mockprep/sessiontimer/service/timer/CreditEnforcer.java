package com.mockprep.sessiontimer.service.timer;

import com.mockprep.sessiontimer.store.AccountLedger;
import com.mockprep.sessiontimer.store.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Stops sessions whose owner can no longer pay. The decision always re-reads the ledger; the
 * cached balance on the entry is only refreshed here for display.
 * <p>
 * A balance of exactly zero keeps the session running: the credit that paid for the session
 * was deducted when it started.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CreditEnforcer {

    static final String ACCOUNT_NOT_FOUND = "Account not found";

    private final AccountLedger accountLedger;
    private final SessionStore sessionStore;
    private final TimerRegistry timerRegistry;
    private final Clock clock;

    /**
     * @return true if the session was terminated
     */
    public boolean enforce(TimerEntry entry) {
        Long sessionId = entry.getSessionId();
        Optional<Integer> balance = accountLedger.getBalance(entry.getAccountId());

        if (balance.isEmpty()) {
            log.error("Account {} not found for session {}, stopping timer", entry.getAccountId(), sessionId);
            return autoStop(entry, ACCOUNT_NOT_FOUND);
        }

        int credits = balance.get();
        entry.updateKnownBalance(credits);

        if (credits < 0) {
            log.info("Stopping session {}: account has insufficient credits ({})", sessionId, credits);
            return autoStop(entry, "Insufficient credits: " + credits);
        }
        return false;
    }

    /**
     * Terminates through the same path as a manual stop: the registry removal decides whether
     * this call wins, then the store record is completed with an appended note.
     */
    boolean autoStop(TimerEntry entry, String reason) {
        Long sessionId = entry.getSessionId();
        Optional<StopResult> stopped = timerRegistry.stop(sessionId, reason);
        if (stopped.isEmpty()) {
            return false;
        }

        StopResult result = stopped.get();
        Instant now = clock.instant();
        int rows = sessionStore.completeSession(sessionId, (int) result.getElapsedMinutes(),
                "\n[" + now + "] Session auto-stopped: " + reason);

        timerRegistry.publish(SessionTimerEvent.Type.SESSION_AUTO_STOPPED, sessionId, entry.getAccountId(), now, Map.of(
                "reason", reason,
                "elapsedMinutes", result.getElapsedMinutes(),
                "recordsUpdated", rows));
        log.info("Session {} auto-stopped due to: {}", sessionId, reason);
        return true;
    }
}
