package com.mockprep.sessiontimer.controller;

import com.mockprep.sessiontimer.service.timer.SessionTimerService;
import com.mockprep.sessiontimer.service.timer.TimerStats;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final SessionTimerService sessionTimerService;

    @GetMapping({"", "/"})
    public Map<String, String> healthCheck() {
        return Map.of(
                "status", "healthy",
                "service", "Interview Session Timer",
                "version", "1.0.0"
        );
    }

    @GetMapping("/ready")
    public Map<String, Object> readinessCheck() {
        TimerStats stats = sessionTimerService.getStats();
        return Map.of(
                "status", "ready",
                "timer", Map.of(
                        "loop_running", stats.isRunning(),
                        "active_timers", stats.getActiveTimers()
                )
        );
    }
}
