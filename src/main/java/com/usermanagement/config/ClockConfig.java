package com.usermanagement.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * UTC clock used for record timestamps
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
