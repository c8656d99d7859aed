package com.example.redline.domain;

import java.util.Objects;

/**
 * Snapshot of one citation's position in the pipeline. Each transition returns a new snapshot and
 * rejects moves the state machine does not allow.
 */
public record CitationProgress(
        Citation citation, PipelineState state, AmendmentOperation operation, ComparisonResult result) {

    public CitationProgress {
        Objects.requireNonNull(citation, "citation");
        Objects.requireNonNull(state, "state");
    }

    public static CitationProgress detected(Citation citation) {
        return new CitationProgress(citation, PipelineState.DETECTED, null, null);
    }

    public CitationProgress definitionalSkipped() {
        return advance(PipelineState.DEFINITIONAL_SKIPPED, citation, null, null);
    }

    public CitationProgress fetching() {
        return advance(PipelineState.FETCHING, citation, null, null);
    }

    public CitationProgress fetched(FetchedStatute statute) {
        return advance(PipelineState.FETCHED, citation.withFetched(statute), null, null);
    }

    public CitationProgress fetchFailed(FetchFailure failure) {
        return advance(PipelineState.FETCH_FAILED, citation.withFetchFailure(failure), null, null);
    }

    public CitationProgress parsed(AmendmentOperation parsedOperation) {
        return advance(PipelineState.PARSED, citation, parsedOperation, null);
    }

    public CitationProgress mutated() {
        return advance(PipelineState.MUTATED, citation, operation, null);
    }

    public CitationProgress diffed(ComparisonResult comparison) {
        return advance(PipelineState.DIFFED, citation, operation, comparison);
    }

    private CitationProgress advance(
            PipelineState next, Citation nextCitation, AmendmentOperation nextOperation, ComparisonResult nextResult) {
        if (!state.canAdvanceTo(next)) {
            throw new IllegalStateException(
                    "Citation " + citation.id() + " cannot move from " + state + " to " + next);
        }
        return new CitationProgress(nextCitation, next, nextOperation, nextResult);
    }
}
