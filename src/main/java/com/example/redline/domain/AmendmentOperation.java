package com.example.redline.domain;

import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * A classified amendment instruction for one citation.
 *
 * <p>{@code oldTexts} holds the literal spans to strike, or the anchor text for
 * insert-after/before. {@code unitReference} names a structural unit the instruction acts on
 * (the struck unit, the anchor unit, or the unit preceding designated matter).
 * {@code furtherAmendments} are applied in order after this operation.
 */
@Builder(toBuilder = true)
public record AmendmentOperation(
        AmendmentKind kind,
        List<StructuralLabel> targetPath,
        List<String> oldTexts,
        String newText,
        boolean eachPlaceAppears,
        boolean atEnd,
        List<LabelPair> labelMapping,
        StructuralLabel unitReference,
        String instruction,
        List<AmendmentOperation> furtherAmendments) {

    public AmendmentOperation {
        Objects.requireNonNull(kind, "kind");
        targetPath = targetPath == null ? List.of() : List.copyOf(targetPath);
        oldTexts = oldTexts == null ? List.of() : List.copyOf(oldTexts);
        newText = newText == null ? "" : newText;
        labelMapping = labelMapping == null ? List.of() : List.copyOf(labelMapping);
        instruction = instruction == null ? "" : instruction;
        furtherAmendments = furtherAmendments == null ? List.of() : List.copyOf(furtherAmendments);
    }

    public static AmendmentOperation unknown(String instruction, List<StructuralLabel> targetPath) {
        return AmendmentOperation.builder()
                .kind(AmendmentKind.UNKNOWN)
                .targetPath(targetPath)
                .instruction(instruction)
                .build();
    }

    /** Kinds of the chained operations, in application order. */
    public List<AmendmentKind> chainedKinds() {
        return furtherAmendments.stream().map(AmendmentOperation::kind).toList();
    }

    public AmendmentOperation withFurtherAmendments(List<AmendmentOperation> chain) {
        return toBuilder().furtherAmendments(chain).build();
    }
}
