package com.tradejournal.application.config;

import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Resiliency configuration. Named retries (connect, publish, apply, store) are
 * registered here by {@link com.tradejournal.infrastructure.resilience.RetryFactory}
 * from the policies under {@code app.relay}.
 */
@Configuration
public class ResiliencyConfig {

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    /**
     * Source of entry and exit timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
