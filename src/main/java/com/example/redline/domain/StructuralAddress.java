package com.example.redline.domain;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Title, section and the path of labels below the section. Path levels are strictly nested.
 */
public record StructuralAddress(int title, String section, List<StructuralLabel> path) {
    public StructuralAddress {
        Objects.requireNonNull(section, "section");
        path = path == null ? List.of() : List.copyOf(path);
        StructuralLevel previous = null;
        for (StructuralLabel label : path) {
            if (!label.level().isDeeperThan(previous)) {
                throw new IllegalArgumentException(
                        "Structural path out of order at " + label + " in " + section);
            }
            previous = label.level();
        }
    }

    public String pathNotation() {
        return path.stream().map(StructuralLabel::marker).collect(Collectors.joining());
    }
}
