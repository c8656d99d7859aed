package com.example.redline.domain;

import java.util.Objects;

/**
 * A statutory reference found in a document. Instances are immutable; a fetch outcome is recorded
 * exactly once through {@link #withFetched(FetchedStatute)} or {@link #withFetchFailure(FetchFailure)}.
 */
public record Citation(
        String id,
        CitationType type,
        StructuralAddress address,
        String rawText,
        int startOffset,
        int endOffset,
        boolean definitional,
        FetchStatus fetchStatus,
        FetchedStatute statute,
        FetchFailure fetchFailure) {

    public Citation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(rawText, "rawText");
        fetchStatus = fetchStatus == null ? FetchStatus.UNFETCHED : fetchStatus;
        if (fetchStatus == FetchStatus.FETCHED && statute == null) {
            throw new IllegalArgumentException("Fetched citation " + id + " carries no statute text");
        }
        if (fetchStatus == FetchStatus.FAILED && fetchFailure == null) {
            throw new IllegalArgumentException("Failed citation " + id + " carries no failure");
        }
    }

    public static Citation detected(
            int ordinal,
            CitationType type,
            StructuralAddress address,
            String rawText,
            int startOffset,
            int endOffset,
            boolean definitional) {
        return new Citation(
                "c-" + ordinal,
                type,
                address,
                rawText,
                startOffset,
                endOffset,
                definitional,
                FetchStatus.UNFETCHED,
                null,
                null);
    }

    public Citation withFetched(FetchedStatute fetched) {
        requireUnfetched();
        return new Citation(
                id, type, address, rawText, startOffset, endOffset, definitional,
                FetchStatus.FETCHED, Objects.requireNonNull(fetched, "fetched"), null);
    }

    public Citation withFetchFailure(FetchFailure failure) {
        requireUnfetched();
        return new Citation(
                id, type, address, rawText, startOffset, endOffset, definitional,
                FetchStatus.FAILED, null, Objects.requireNonNull(failure, "failure"));
    }

    /** A fresh unfetched copy for a new fetch attempt; the failed snapshot stays as it was. */
    public Citation forRetry() {
        return new Citation(
                id, type, address, rawText, startOffset, endOffset, definitional,
                FetchStatus.UNFETCHED, null, null);
    }

    public StatuteKey statuteKey() {
        return new StatuteKey(type, address.title(), address.section());
    }

    public String canonical() {
        return switch (type) {
            case USC -> address.title() + " U.S.C. § " + address.section() + address.pathNotation();
            case CFR -> address.title() + " C.F.R. § " + address.section();
            case PUBLAW -> "Pub. L. " + address.title() + "-" + address.section();
        };
    }

    private void requireUnfetched() {
        if (fetchStatus != FetchStatus.UNFETCHED) {
            throw new IllegalStateException(
                    "Citation " + id + " already has fetch outcome " + fetchStatus);
        }
    }
}
