package com.railwise.backend.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the background schedule reload and crowd cleanup jobs. Can be
 * switched off with {@code railwise.scheduling.enabled=false}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "railwise.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
