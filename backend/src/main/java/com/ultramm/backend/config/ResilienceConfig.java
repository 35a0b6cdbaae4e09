package com.ultramm.backend.config;

import com.ultramm.backend.exception.ExecutionFatalException;
import com.ultramm.backend.exception.ExecutionTransientException;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResilienceConfig {

    /**
     * Order placement retry: {@code retry-attempts} retries after the first call, fixed delay,
     * transient failures only.
     */
    @Bean
    public RetryConfig orderRetryConfig(ExecutionProperties executionProperties) {
        return RetryConfig.custom()
                .maxAttempts(executionProperties.getRetryAttempts() + 1)
                .waitDuration(executionProperties.getRetryDelay())
                .retryExceptions(ExecutionTransientException.class)
                .ignoreExceptions(ExecutionFatalException.class)
                .build();
    }
}
