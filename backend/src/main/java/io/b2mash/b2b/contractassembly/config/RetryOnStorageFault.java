package io.b2mash.b2b.contractassembly.config;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Retries a transactional service method when storage is unavailable: 3 attempts, 200ms backoff
 * doubling each time. Domain failures (lifecycle, gate, concurrency losers) are never retried.
 * After the last attempt the storage exception propagates and is rendered as 503.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Retryable(
    retryFor = {
      DataAccessResourceFailureException.class,
      TransientDataAccessResourceException.class,
      CannotCreateTransactionException.class,
      QueryTimeoutException.class
    },
    maxAttempts = 3,
    backoff = @Backoff(delay = 200, multiplier = 2))
public @interface RetryOnStorageFault {}
