package com.example.redline.domain;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of redlining one citation. {@code hasChanges} is always false when the original and
 * amended texts are equal, whatever the caller passes.
 */
public record ComparisonResult(
        String citationId,
        String citationText,
        AmendmentKind amendmentKind,
        List<AmendmentKind> chainedKinds,
        boolean resolved,
        String originalText,
        String amendedText,
        String diffHtml,
        String originalSideHtml,
        String amendedSideHtml,
        String condensedHtml,
        int deletedWords,
        int insertedWords,
        boolean hasChanges) {

    public ComparisonResult {
        Objects.requireNonNull(citationId, "citationId");
        Objects.requireNonNull(amendmentKind, "amendmentKind");
        chainedKinds = chainedKinds == null ? List.of() : List.copyOf(chainedKinds);
        originalText = originalText == null ? "" : originalText;
        amendedText = amendedText == null ? "" : amendedText;
        hasChanges = hasChanges && !originalText.equals(amendedText);
    }
}
