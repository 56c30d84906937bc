package com.company.powersense.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retry policies shared by every store read/write and by the upstream fetch.
 * Backoff is linear: the n-th wait lasts {@code retryDelay * n}.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class RetryConfiguration {

    public static final String STORE_RETRY = "clickhouseStore";
    public static final String UPSTREAM_RETRY = "upstreamApi";

    private final PowerSenseProperties properties;

    @Bean
    public Retry storeRetry(RetryRegistry retryRegistry) {
        PowerSenseProperties.Store store = properties.getStore();
        return register(retryRegistry, STORE_RETRY,
                linearRetryConfig(store.getMaxAttempts(), store.getRetryDelay(),
                        TransientErrors::isTransientStoreError));
    }

    @Bean
    public Retry upstreamRetry(RetryRegistry retryRegistry) {
        PowerSenseProperties.Upstream upstream = properties.getUpstream();
        return register(retryRegistry, UPSTREAM_RETRY,
                linearRetryConfig(upstream.getMaxAttempts(), upstream.getRetryDelay(),
                        TransientErrors::isTransientUpstreamError));
    }

    public static RetryConfig linearRetryConfig(int maxAttempts, Duration delay, Predicate<Throwable> retryable) {
        long delayMillis = delay.toMillis();
        IntervalFunction linear = attempt -> delayMillis * attempt;
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(linear)
                .retryOnException(retryable)
                .failAfterMaxAttempts(false)
                .build();
    }

    private Retry register(RetryRegistry retryRegistry, String name, RetryConfig config) {
        Retry retry = retryRegistry.retry(name, config);
        retry.getEventPublisher()
                .onRetry(event -> log.warn("{} attempt {} failed, retrying in {}ms: {}",
                        name, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"))
                .onError(event -> log.error("{} gave up after {} attempts",
                        name, event.getNumberOfRetryAttempts()));
        return retry;
    }
}
