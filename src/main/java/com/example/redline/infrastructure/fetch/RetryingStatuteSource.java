package com.example.redline.infrastructure.fetch;

import com.example.redline.application.StatuteFetchException;
import com.example.redline.application.StatuteSource;
import com.example.redline.domain.FetchedStatute;
import com.example.redline.domain.StatuteKey;
import io.github.resilience4j.core.functions.Either;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;

/**
 * Retries rate-limited and transport failures. A reset hint from the source is waited out (capped
 * at the maximum backoff); without one the wait doubles from the initial backoff. Not-found
 * failures are final.
 */
public class RetryingStatuteSource implements StatuteSource {
    private static final Logger log = LogManager.getLogger(RetryingStatuteSource.class);

    private final StatuteSource delegate;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Retry retry;

    public RetryingStatuteSource(
            StatuteSource delegate, int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        this.delegate = delegate;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        RetryConfig config =
                RetryConfig.<FetchedStatute>custom()
                        .maxAttempts(Math.max(1, maxAttempts))
                        .retryOnException(RetryingStatuteSource::isRetryable)
                        .intervalBiFunction(
                                (Integer attempt, Either<Throwable, FetchedStatute> outcome) ->
                                        backoff(attempt, outcome.isLeft() ? outcome.getLeft() : null)
                                                .toMillis())
                        .build();
        this.retry = Retry.of("statute-fetch", config);
        this.retry
                .getEventPublisher()
                .onRetry(
                        event ->
                                log.warn(
                                        "Retrying statute fetch (attempt {}) after {} ms: {}",
                                        event.getNumberOfRetryAttempts(),
                                        event.getWaitInterval().toMillis(),
                                        event.getLastThrowable() == null
                                                ? "no result"
                                                : event.getLastThrowable().getMessage()));
    }

    @Override
    public FetchedStatute fetch(StatuteKey key) {
        return retry.executeSupplier(() -> delegate.fetch(key));
    }

    /** Wait before the retry that follows failed attempt number {@code attempt} (1-based). */
    Duration backoff(int attempt, Throwable failure) {
        if (failure instanceof StatuteFetchException) {
            Duration hint = ((StatuteFetchException) failure).retryAfter().orElse(null);
            if (hint != null) {
                return hint.compareTo(maxBackoff) > 0 ? maxBackoff : hint;
            }
        }
        Duration exponential = initialBackoff.multipliedBy(1L << Math.min(Math.max(attempt - 1, 0), 20));
        return exponential.compareTo(maxBackoff) > 0 ? maxBackoff : exponential;
    }

    private static boolean isRetryable(Throwable throwable) {
        return throwable instanceof StatuteFetchException
                && ((StatuteFetchException) throwable).kind().isRetryable();
    }
}
