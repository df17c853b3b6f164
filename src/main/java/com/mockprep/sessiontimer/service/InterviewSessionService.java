package com.mockprep.sessiontimer.service;

import com.mockprep.sessiontimer.dto.SessionStartResponseDto;
import com.mockprep.sessiontimer.model.InterviewSession;
import com.mockprep.sessiontimer.repository.InterviewSessionRepository;
import com.mockprep.sessiontimer.repository.UserAccountRepository;
import com.mockprep.sessiontimer.service.timer.SessionStartResult;
import com.mockprep.sessiontimer.service.timer.SessionTimerService;
import com.mockprep.sessiontimer.service.timer.StopResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Session state changes driven by the web and desktop apps. Starting a session costs one credit;
 * from then on the background timer owns the session's duration.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InterviewSessionService {

    private final InterviewSessionRepository sessionRepository;
    private final UserAccountRepository userAccountRepository;
    private final SessionTimerService sessionTimerService;
    private final Clock clock;

    @Transactional
    public SessionStartResponseDto startSession(Long sessionId, Long userId, Integer estimatedDurationMinutes) {
        InterviewSession session = sessionRepository.findByIdAndUserId(sessionId, userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Session not found or access denied"));

        if (!InterviewSession.STATUS_CREATED.equals(session.getStatus())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Cannot start session with status: " + session.getStatus());
        }

        if (userAccountRepository.deductOneCredit(userId) == 0) {
            throw new ResponseStatusException(HttpStatus.PAYMENT_REQUIRED, "Insufficient credits");
        }

        Integer estimate = estimatedDurationMinutes != null
                ? estimatedDurationMinutes
                : session.getEstimatedDurationMinutes();

        SessionStartResult started = sessionTimerService.handleSessionStart(
                sessionId, userId, estimate, session.getJobTitle());
        if (!started.isAlreadyTracked()) {
            endTimerOnRollback(sessionId);
        }

        session.setStatus(InterviewSession.STATUS_ACTIVE);
        session.setStartedAt(started.getStartTime());
        session.setEstimatedDurationMinutes(estimate);
        session.setUpdatedAt(clock.instant());
        sessionRepository.save(session);

        Integer credits = userAccountRepository.findCreditsById(userId).orElse(null);
        log.info("Session {} started by user {} ({} credits remaining)", sessionId, userId, credits);

        return SessionStartResponseDto.builder()
                .sessionId(sessionId)
                .status(session.getStatus())
                .startTime(started.getStartTime())
                .estimatedDurationMinutes(estimate)
                .creditsRemaining(credits)
                .build();
    }

    /**
     * Normal end of an interview: the timer hands back the elapsed minutes and the session is
     * marked completed. The completion is a guarded write, so a session that the credit check
     * already completed keeps its record and the caller gets a conflict.
     */
    @Transactional
    public Map<String, Object> completeSession(Long sessionId, Long userId) {
        InterviewSession session = sessionRepository.findByIdAndUserId(sessionId, userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Session not found or access denied"));

        if (!InterviewSession.STATUS_ACTIVE.equals(session.getStatus())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Cannot complete session with status: " + session.getStatus());
        }

        Optional<StopResult> ended = sessionTimerService.handleSessionEnd(sessionId, "Interview completed");
        int minutes = ended.map(r -> (int) r.getElapsedMinutes())
                .orElseGet(() -> session.getTotalDurationMinutes() != null ? session.getTotalDurationMinutes() : 0);

        int rows = sessionRepository.finishIfActive(sessionId, userId, minutes, clock.instant());
        if (rows == 0) {
            log.warn("Session {} was completed elsewhere before user {} completed it", sessionId, userId);
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Session is no longer active");
        }

        Map<String, Object> result = new HashMap<>();
        result.put("message", "Session completed");
        result.put("total_duration_minutes", minutes);
        result.put("timer_was_active", ended.isPresent());
        return result;
    }

    /**
     * The registry is not transactional: a start whose credit deduction or status change rolls
     * back must not leave a timer running against a {@code created} row.
     */
    private void endTimerOnRollback(Long sessionId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED) {
                    log.warn("Start of session {} did not commit, discarding its timer", sessionId);
                    sessionTimerService.handleSessionEnd(sessionId, "Start rolled back");
                }
            }
        });
    }
}
