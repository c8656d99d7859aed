package com.example.redline.application.mutate;

import com.example.redline.domain.AmendmentKind;
import com.example.redline.domain.AmendmentOperation;
import com.example.redline.domain.LabelPair;
import com.example.redline.domain.StructuralLabel;
import com.example.redline.domain.StructuralLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.redline.application.mutate.StructureLocatorTest.STATUTE;
import static org.assertj.core.api.Assertions.assertThat;

class TextMutatorTest {

    private static final StructuralLabel B = new StructuralLabel(StructuralLevel.SUBSECTION, "b");
    private static final StructuralLabel C = new StructuralLabel(StructuralLevel.SUBSECTION, "c");
    private static final String PARAGRAPH_TWO = "    (2) Exception.--Paragraph (1) shall not apply.\n";

    private final TextMutator mutator = new TextMutator(new StructureLocator());

    @Test
    void replacesEveryOccurrenceForEachPlace() {
        AmendmentOperation operation =
                AmendmentOperation.builder()
                        .kind(AmendmentKind.EACH_PLACE_APPEARS)
                        .oldTexts(List.of("2023"))
                        .newText("2024")
                        .build();

        MutationOutcome outcome = mutator.apply(STATUTE, operation);

        assertThat(outcome.resolved()).isTrue();
        assertThat(outcome.amendedText()).isEqualTo(STATUTE.replace("2023", "2024"));
    }

    @Test
    void strikeAndInsertOnlyTouchesTheAddressedUnit() {
        MutationOutcome outcome = mutator.apply(STATUTE, strikeInsert(List.of(B, paragraph("1")), "2023", "2024"));

        assertThat(outcome.resolved()).isTrue();
        assertThat(outcome.amendedText())
                .isEqualTo(STATUTE.replace("made after fiscal year 2023", "made after fiscal year 2024"));
    }

    @Test
    void redesignatesInOnePass() {
        AmendmentOperation operation =
                AmendmentOperation.builder()
                        .kind(AmendmentKind.REDESIGNATE)
                        .targetPath(List.of(B))
                        .labelMapping(
                                List.of(
                                        new LabelPair(paragraph("2"), paragraph("3")),
                                        new LabelPair(paragraph("3"), paragraph("4"))))
                        .build();

        MutationOutcome outcome = mutator.apply(STATUTE, operation);

        assertThat(outcome.resolved()).isTrue();
        assertThat(outcome.amendedText())
                .isEqualTo(STATUTE.replace("(2) Exception", "(3) Exception").replace("(3) Reports", "(4) Reports"))
                .contains("Paragraph (1) shall not apply");
    }

    @Test
    void chainIsAllOrNothing() {
        AmendmentOperation operation =
                strikeInsert(List.of(B, paragraph("1")), "2023", "2024")
                        .withFurtherAmendments(List.of(strikeInsert(List.of(B), "no such words", "other words")));

        MutationOutcome outcome = mutator.apply(STATUTE, operation);

        assertThat(outcome.resolved()).isFalse();
        assertThat(outcome.amendedText()).isEqualTo(STATUTE);
    }

    @Test
    void chainAppliesStepsInOrder() {
        AmendmentOperation operation =
                strikeInsert(List.of(B, paragraph("1")), "2023", "2024")
                        .withFurtherAmendments(
                                List.of(
                                        AmendmentOperation.builder()
                                                .kind(AmendmentKind.ADD_AT_END)
                                                .targetPath(List.of(B))
                                                .newText("(4) Sunset.--This subsection expires in 2030.")
                                                .build()));

        MutationOutcome outcome = mutator.apply(STATUTE, operation);

        assertThat(outcome.resolved()).isTrue();
        assertThat(outcome.amendedText())
                .contains("made after fiscal year 2024.")
                .contains("annually.\n    (4) Sunset.--This subsection expires in 2030.\n(c)")
                .startsWith("(a) In general.--The amount shall be $1,000 for fiscal year 2023.");
    }

    @Test
    void addedUnitTakesTheIndentationOfItsSiblings() {
        AmendmentOperation operation =
                AmendmentOperation.builder()
                        .kind(AmendmentKind.ADD_AT_END)
                        .targetPath(List.of(B))
                        .newText("(4) Sunset.--This subsection expires in 2030.")
                        .build();

        MutationOutcome outcome = mutator.apply(STATUTE, operation);

        assertThat(outcome.resolved()).isTrue();
        assertThat(outcome.amendedText())
                .isEqualTo(STATUTE.replace(
                        "report annually.\n",
                        "report annually.\n    (4) Sunset.--This subsection expires in 2030.\n"));
    }

    @Test
    void unknownOperationLeavesTextUnchanged() {
        MutationOutcome outcome = mutator.apply(STATUTE, AmendmentOperation.unknown("is repealed", List.of()));

        assertThat(outcome.resolved()).isFalse();
        assertThat(outcome.amendedText()).isEqualTo(STATUTE);
    }

    @Test
    void readAsFollowsReplacesTheUnit() {
        AmendmentOperation operation =
                AmendmentOperation.builder()
                        .kind(AmendmentKind.READ_AS_FOLLOWS)
                        .targetPath(List.of(B, paragraph("3")))
                        .newText("(3) Reports.--The Secretary shall report biennially.")
                        .build();

        assertThat(mutator.apply(STATUTE, operation).amendedText())
                .isEqualTo(STATUTE.replace("report annually.", "report biennially."));
    }

    @Test
    void insertAfterKeepsPunctuationTight() {
        AmendmentOperation operation =
                AmendmentOperation.builder()
                        .kind(AmendmentKind.INSERT_AFTER)
                        .targetPath(List.of(C))
                        .oldTexts(List.of("District of Columbia"))
                        .newText(", Puerto Rico")
                        .build();

        assertThat(mutator.apply(STATUTE, operation).amendedText())
                .isEqualTo(STATUTE.replace("District of Columbia.", "District of Columbia, Puerto Rico."));
    }

    @Test
    void addAtBeginningPrefixesTheUnitContent() {
        AmendmentOperation operation =
                AmendmentOperation.builder()
                        .kind(AmendmentKind.ADD_AT_BEGINNING)
                        .targetPath(List.of(C))
                        .newText("Except as provided in subsection (d),")
                        .build();

        assertThat(mutator.apply(STATUTE, operation).amendedText())
                .contains("(c) Except as provided in subsection (d), Definitions.--");
    }

    @Test
    void strikingAUnitRemovesItWithItsLine() {
        AmendmentOperation operation =
                AmendmentOperation.builder()
                        .kind(AmendmentKind.STRIKE)
                        .targetPath(List.of(B))
                        .unitReference(paragraph("2"))
                        .build();

        assertThat(mutator.apply(STATUTE, operation).amendedText()).isEqualTo(STATUTE.replace(PARAGRAPH_TWO, ""));
    }

    @Test
    void strikeAndRedesignateRenumbersTheRemainder() {
        AmendmentOperation operation =
                AmendmentOperation.builder()
                        .kind(AmendmentKind.STRIKE_REDESIGNATE)
                        .targetPath(List.of(B))
                        .unitReference(paragraph("2"))
                        .labelMapping(List.of(new LabelPair(paragraph("3"), paragraph("2"))))
                        .build();

        assertThat(mutator.apply(STATUTE, operation).amendedText())
                .isEqualTo(STATUTE.replace(PARAGRAPH_TWO, "").replace("(3) Reports", "(2) Reports"));
    }

    @Test
    void strikingLiteralTextDropsTheLeftoverSpace() {
        AmendmentOperation operation =
                AmendmentOperation.builder()
                        .kind(AmendmentKind.STRIKE)
                        .targetPath(List.of(B, paragraph("3")))
                        .oldTexts(List.of("annually"))
                        .build();

        assertThat(mutator.apply(STATUTE, operation).amendedText())
                .isEqualTo(STATUTE.replace("report annually.", "report."));
    }

    private static AmendmentOperation strikeInsert(List<StructuralLabel> path, String oldText, String newText) {
        return AmendmentOperation.builder()
                .kind(AmendmentKind.STRIKE_INSERT)
                .targetPath(path)
                .oldTexts(List.of(oldText))
                .newText(newText)
                .build();
    }

    private static StructuralLabel paragraph(String label) {
        return new StructuralLabel(StructuralLevel.PARAGRAPH, label);
    }
}
