package com.example.redline.application;

import com.example.redline.domain.FetchFailure;
import com.example.redline.domain.FetchFailureKind;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

public class StatuteFetchException extends RuntimeException {
    private final FetchFailureKind kind;
    private final Duration retryAfter;

    public StatuteFetchException(FetchFailureKind kind, String message) {
        this(kind, message, null, null);
    }

    public StatuteFetchException(FetchFailureKind kind, String message, Duration retryAfter) {
        this(kind, message, retryAfter, null);
    }

    public StatuteFetchException(FetchFailureKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    private StatuteFetchException(
            FetchFailureKind kind, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.retryAfter = retryAfter;
    }

    public FetchFailureKind kind() {
        return kind;
    }

    /** Reset hint sent with a rate-limit response, if the source gave one. */
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public FetchFailure toFailure() {
        return new FetchFailure(kind, getMessage());
    }
}
