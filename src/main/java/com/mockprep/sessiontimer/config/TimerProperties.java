package com.mockprep.sessiontimer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "timer")
public class TimerProperties {

    /** Recover persisted sessions and start the reconciliation loop on startup. */
    private boolean enabled = true;

    private Duration tickInterval = Duration.ofSeconds(30);

    /** Delay of the first tick after startup, so recovered sessions are not stale for a full interval. */
    private Duration initialDelay = Duration.ofSeconds(1);

    private Duration creditCheckInterval = Duration.ofMinutes(5);

    /** A session overruns once its elapsed minutes reach estimate * factor. */
    private double overrunFactor = 1.5;

    private int overrunExtensionMinutes = 30;

    private int defaultEstimatedMinutes = 60;
}
