package com.example.redline.domain;

import java.util.Objects;

public record AnalysisRequest(String documentId, String name, String text) {
    public AnalysisRequest {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(text, "text");
        name = name == null || name.isBlank() ? documentId : name.trim();
    }
}
