package com.mockprep.sessiontimer.controller;

import com.mockprep.sessiontimer.dto.SessionStartRequestDto;
import com.mockprep.sessiontimer.dto.SessionStartResponseDto;
import com.mockprep.sessiontimer.dto.SessionStopRequestDto;
import com.mockprep.sessiontimer.service.InterviewSessionService;
import com.mockprep.sessiontimer.service.timer.ManualStopResult;
import com.mockprep.sessiontimer.service.timer.SessionTimerService;
import com.mockprep.sessiontimer.service.timer.TimerOperationException;
import com.mockprep.sessiontimer.service.timer.TimerSnapshot;
import com.mockprep.sessiontimer.service.timer.TimerStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionTimerController {

    private final InterviewSessionService interviewSessionService;
    private final SessionTimerService sessionTimerService;

    // ─── Lifecycle ──────────────────────────────────────────────────────

    @PostMapping("/{sessionId}/start")
    public SessionStartResponseDto startSession(@PathVariable Long sessionId,
                                                @RequestBody SessionStartRequestDto request) {
        if (request.getUserId() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userId is required");
        }
        return interviewSessionService.startSession(sessionId, request.getUserId(),
                request.getEstimatedDurationMinutes());
    }

    @PostMapping("/{sessionId}/stop")
    public ManualStopResult stopSession(@PathVariable Long sessionId,
                                        @RequestBody SessionStopRequestDto request) {
        if (request.getUserId() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userId is required");
        }
        try {
            return sessionTimerService.handleManualStop(sessionId, request.getUserId(), request.getReason());
        } catch (TimerOperationException e) {
            throw new ResponseStatusException(toStatus(e.getReason()), e.getMessage());
        }
    }

    @PutMapping("/{sessionId}/complete")
    public Map<String, Object> completeSession(@PathVariable Long sessionId, @RequestParam Long userId) {
        return interviewSessionService.completeSession(sessionId, userId);
    }

    // ─── Timers ─────────────────────────────────────────────────────────

    @GetMapping("/{sessionId}/timer")
    public TimerSnapshot getTimerStatus(@PathVariable Long sessionId) {
        return sessionTimerService.getTimerStatus(sessionId);
    }

    @GetMapping("/timers")
    public List<TimerSnapshot> getActiveTimers() {
        return sessionTimerService.getAllActiveTimers();
    }

    @GetMapping("/timers/stats")
    public TimerStats getTimerStats() {
        return sessionTimerService.getStats();
    }

    private HttpStatus toStatus(TimerOperationException.Reason reason) {
        switch (reason) {
            case ACCESS_DENIED:
                return HttpStatus.FORBIDDEN;
            case NOT_ACTIVE:
                return HttpStatus.CONFLICT;
            case NOT_FOUND:
            default:
                return HttpStatus.NOT_FOUND;
        }
    }
}
