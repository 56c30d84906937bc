package com.company.powersense.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfiguration {

    // Cycle windows are computed from this clock
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
