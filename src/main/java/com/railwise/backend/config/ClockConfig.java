package com.railwise.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Service clock. Timetables are published in local railway time, so "now"
 * is taken in the configured zone rather than the host's.
 */
@Configuration
@Slf4j
public class ClockConfig {

    @Value("${railwise.timezone:Asia/Dhaka}")
    private String timezone;

    @Bean
    public Clock clock() {
        ZoneId zone = ZoneId.of(timezone);
        log.info("🕒 Service clock zone: {}", zone);
        return Clock.system(zone);
    }
}
