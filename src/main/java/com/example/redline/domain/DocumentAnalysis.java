package com.example.redline.domain;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a document run: every detected citation with its state, and the comparison results
 * of the citations that reached {@link PipelineState#DIFFED}, in document order.
 */
public record DocumentAnalysis(
        String documentId,
        String name,
        List<CitationProgress> citations,
        List<ComparisonResult> results,
        boolean complete,
        boolean withdrawn,
        AnalysisTiming timing) {

    public DocumentAnalysis {
        Objects.requireNonNull(documentId, "documentId");
        citations = citations == null ? List.of() : List.copyOf(citations);
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static DocumentAnalysis of(
            String documentId,
            String name,
            List<CitationProgress> citations,
            boolean complete,
            boolean withdrawn,
            AnalysisTiming timing) {
        List<ComparisonResult> results =
                citations.stream()
                        .filter(progress -> progress.state() == PipelineState.DIFFED)
                        .map(CitationProgress::result)
                        .toList();
        return new DocumentAnalysis(documentId, name, citations, results, complete, withdrawn, timing);
    }
}
