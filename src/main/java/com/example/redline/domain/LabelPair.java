package com.example.redline.domain;

import java.util.Objects;

public record LabelPair(StructuralLabel from, StructuralLabel to) {
    public LabelPair {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }
}
