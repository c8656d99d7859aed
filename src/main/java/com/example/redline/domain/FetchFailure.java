package com.example.redline.domain;

import java.util.Objects;

public record FetchFailure(FetchFailureKind kind, String message) {
    public FetchFailure {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }
}
