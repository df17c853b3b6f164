package com.mockprep.sessiontimer.store;

import com.mockprep.sessiontimer.model.InterviewSession;
import com.mockprep.sessiontimer.repository.InterviewSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Component
@Slf4j
@RequiredArgsConstructor
public class JpaSessionStore implements SessionStore {

    private final InterviewSessionRepository sessionRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<ActiveSessionRecord> findActiveSessionsWithOwnerBalance() {
        return sessionRepository.findActiveSessionsWithOwnerBalance();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SessionOwnership> findOwnership(Long sessionId) {
        return sessionRepository.findById(sessionId)
                .map(s -> new SessionOwnership(s.getId(), s.getUserId(), s.getStatus()));
    }

    @Override
    @Transactional
    public int updateDuration(Long sessionId, int minutes) {
        int rows = sessionRepository.updateDurationIfActive(sessionId, minutes, clock.instant());
        if (rows == 0) {
            log.debug("Duration update for session {} matched no {} row", sessionId, InterviewSession.STATUS_ACTIVE);
        }
        return rows;
    }

    @Override
    @Transactional
    public int completeSession(Long sessionId, int minutes, String noteAppend) {
        int rows = sessionRepository.completeIfActive(sessionId, minutes, noteAppend, clock.instant());
        if (rows == 0) {
            log.debug("Completion of session {} matched no {} row", sessionId, InterviewSession.STATUS_ACTIVE);
        }
        return rows;
    }
}
