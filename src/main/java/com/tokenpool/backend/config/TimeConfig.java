package com.tokenpool.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    /** ✅ 所有 "now" 都從這裡拿，測試可換成 fixed clock */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
