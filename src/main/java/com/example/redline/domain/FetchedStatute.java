package com.example.redline.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Current authoritative text of one statute section as retrieved from an external source.
 */
public record FetchedStatute(String heading, String text, String sourceUrl, Instant retrievedAt) {
    public FetchedStatute {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(retrievedAt, "retrievedAt");
        heading = heading == null ? "" : heading;
        sourceUrl = sourceUrl == null ? "" : sourceUrl;
    }
}
