package com.example.redline.domain;

import java.util.Objects;

public record EditSpan(EditOperation operation, String text) {
    public EditSpan {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(text, "text");
    }

    public EditSpan append(String more) {
        return new EditSpan(operation, text + more);
    }
}
