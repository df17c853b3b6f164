package com.mockprep.sessiontimer.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable session records. Every write is guarded by {@code status = 'active'}; a write that
 * loses a race against an external status change affects zero rows and is not an error.
 */
public interface SessionStore {

    List<ActiveSessionRecord> findActiveSessionsWithOwnerBalance();

    Optional<SessionOwnership> findOwnership(Long sessionId);

    /**
     * @return number of rows updated, 0 when the session is no longer active
     */
    int updateDuration(Long sessionId, int minutes);

    /**
     * Marks the session completed, stores the final duration and appends {@code noteAppend}
     * to the existing notes.
     *
     * @return number of rows updated, 0 when the session is no longer active
     */
    int completeSession(Long sessionId, int minutes, String noteAppend);
}
