package io.secondbrain.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.secondbrain.provider.ExternalServiceException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;

/**
 * Programmatic Resilience4j wiring for calls to the embedding and extraction providers.
 *
 * One named retry, "externalCall", backs off exponentially on transient provider failures and timeouts.
 * Every attempt is bounded by the time limiter.
 */
@Configuration
public class ResilienceConfig {

    public static final String EXTERNAL_CALL = "externalCall";

    @Bean
    public RetryRegistry retryRegistry(SecondBrainProperties properties) {
        RetryRegistry registry = RetryRegistry.of(externalRetryConfig(properties.external()));
        registry.retry(EXTERNAL_CALL);
        return registry;
    }

    @Bean
    public Retry externalCallRetry(RetryRegistry registry) {
        return registry.retry(EXTERNAL_CALL);
    }

    @Bean
    public TimeLimiter externalCallTimeLimiter(SecondBrainProperties properties) {
        return externalTimeLimiter(properties.external());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService externalCallExecutorService() {
        return Executors.newCachedThreadPool();
    }

    public static RetryConfig externalRetryConfig(SecondBrainProperties.External external) {
        return RetryConfig.custom()
                .maxAttempts(external.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        external.initialBackoff(), external.backoffMultiplier()))
                .retryExceptions(ExternalServiceException.class, TimeoutException.class)
                .build();
    }

    public static TimeLimiter externalTimeLimiter(SecondBrainProperties.External external) {
        return TimeLimiter.of(EXTERNAL_CALL, TimeLimiterConfig.custom()
                .timeoutDuration(external.timeout())
                .cancelRunningFuture(true)
                .build());
    }
}
