package com.quantbacktest.replay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Replay Backtester service.
 * Replays historical bars through a strategy against a simulated execution and accounting engine.
 */
@SpringBootApplication
public class ReplayBacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReplayBacktesterApplication.class, args);
    }

}
