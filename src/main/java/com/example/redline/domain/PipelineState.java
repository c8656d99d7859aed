package com.example.redline.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-citation pipeline states. {@link #DIFFED}, {@link #FETCH_FAILED} and
 * {@link #DEFINITIONAL_SKIPPED} are terminal.
 */
public enum PipelineState {
    DETECTED,
    FETCHING,
    FETCHED,
    FETCH_FAILED,
    PARSED,
    MUTATED,
    DIFFED,
    DEFINITIONAL_SKIPPED;

    public boolean canAdvanceTo(PipelineState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    private Set<PipelineState> successors() {
        return switch (this) {
            case DETECTED -> EnumSet.of(FETCHING, DEFINITIONAL_SKIPPED);
            case FETCHING -> EnumSet.of(FETCHED, FETCH_FAILED);
            case FETCHED -> EnumSet.of(PARSED);
            case PARSED -> EnumSet.of(MUTATED);
            case MUTATED -> EnumSet.of(DIFFED);
            case FETCH_FAILED, DIFFED, DEFINITIONAL_SKIPPED -> EnumSet.noneOf(PipelineState.class);
        };
    }
}
