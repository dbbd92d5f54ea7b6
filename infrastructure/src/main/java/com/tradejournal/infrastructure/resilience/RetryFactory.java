package com.tradejournal.infrastructure.resilience;

import com.tradejournal.domain.exception.TradeRelayException;
import com.tradejournal.domain.retry.RetryPolicy;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds Resilience4j retries from {@link RetryPolicy} values.
 *
 * <p>Every retry backs off exponentially, logs each failed attempt at WARN and
 * gives up at once on failures that report themselves as not retryable.
 */
@Component
public class RetryFactory {

    private static final Logger log = LoggerFactory.getLogger(RetryFactory.class);

    private final RetryRegistry retryRegistry;

    public RetryFactory(RetryRegistry retryRegistry) {
        this.retryRegistry = retryRegistry;
    }

    public Retry create(String name, RetryPolicy policy) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(policy.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(policy.getBaseDelay(), policy.getMultiplier()))
                .retryOnException(RetryFactory::isRetryable)
                .build();

        Retry retry = retryRegistry.retry(name, config);
        retry.getEventPublisher().onRetry(event -> log.warn("{} attempt {}/{} failed, retrying in {} ms: {}",
                event.getName(), event.getNumberOfRetryAttempts(), policy.getMaxAttempts(),
                event.getWaitInterval().toMillis(), describe(event.getLastThrowable())));
        return retry;
    }

    public static boolean isRetryable(Throwable failure) {
        if (failure instanceof InterruptedException) {
            return false;
        }
        if (failure instanceof TradeRelayException) {
            return ((TradeRelayException) failure).isRetryable();
        }
        return true;
    }

    private static String describe(Throwable failure) {
        return failure == null ? "unknown error" : failure.getClass().getSimpleName() + ": " + failure.getMessage();
    }
}
