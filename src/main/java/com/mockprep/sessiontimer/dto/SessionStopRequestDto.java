package com.mockprep.sessiontimer.dto;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionStopRequestDto {
    private Long userId;
    private String reason;
}
