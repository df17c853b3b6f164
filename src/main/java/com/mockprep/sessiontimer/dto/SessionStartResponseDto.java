package com.mockprep.sessiontimer.dto;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import lombok.Builder;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionStartResponseDto {
    private Long sessionId;
    private String status;
    private Instant startTime;
    private Integer estimatedDurationMinutes;
    private Integer creditsRemaining;
}
