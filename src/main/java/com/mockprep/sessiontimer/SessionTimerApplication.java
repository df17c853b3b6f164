package com.mockprep.sessiontimer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SessionTimerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionTimerApplication.class, args);
    }
}
