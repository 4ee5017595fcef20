package com.gt.lse.util;

import com.gt.lse.exception.StoreUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.time.Duration;
import java.util.function.Supplier;

// Retries durable store calls that failed for transient reasons, backing off exponentially between attempts.
public class DurableStoreRetry {

    private static final Logger log = LoggerFactory.getLogger(DurableStoreRetry.class);

    private final Retry retry;

    public DurableStoreRetry(String name, int maxAttempts, Duration initialBackoff, double backoffMultiplier) {
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, backoffMultiplier))
                .retryExceptions(TransientDataAccessException.class,
                                 RecoverableDataAccessException.class,
                                 DataAccessResourceFailureException.class)
                .build();

        this.retry = Retry.of(name, retryConfig);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Durable store call failed, attempt {}. Retrying in {} ms.",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis()));
    }

    public <T> T execute(String operation, Supplier<T> call) {
        try {
            return Retry.decorateSupplier(retry, call).get();
        } catch (TransientDataAccessException | RecoverableDataAccessException | DataAccessResourceFailureException ex) {
            String errMsg = "Durable store unavailable during " + operation;

            log.error(errMsg, ex);
            throw new StoreUnavailableException(errMsg, ex);
        }
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }
}
