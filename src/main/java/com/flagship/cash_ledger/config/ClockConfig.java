package com.flagship.cash_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Single source of "now" for aging windows, watermarks and audit timestamps.
 */
@Configuration
public class ClockConfig {

    /** Ticks in microseconds, the precision the timestamp columns keep. */
    @Bean
    public Clock clock() {
        return Clock.tick(Clock.systemUTC(), Duration.ofNanos(1_000));
    }
}
