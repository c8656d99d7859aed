package com.example.redline.domain;

import java.util.Objects;

/**
 * Identity of a fetchable statute: citations that differ only in their subsection path share one key.
 */
public record StatuteKey(CitationType type, int title, String section) {
    public StatuteKey {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(section, "section");
    }

    @Override
    public String toString() {
        return type.code() + ":" + title + ":" + section;
    }
}
