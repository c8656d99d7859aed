package com.example.redline.domain;

/**
 * Typed reasons a statute fetch can fail. Only {@link #NOT_FOUND} is final on the first attempt.
 */
public enum FetchFailureKind {
    NOT_FOUND,
    RATE_LIMITED,
    TRANSPORT;

    public boolean isRetryable() {
        return this != NOT_FOUND;
    }
}
