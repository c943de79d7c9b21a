package com.flagship.credit_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * Single source of "now" for cooldown windows and monthly caps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
