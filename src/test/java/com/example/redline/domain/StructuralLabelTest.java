package com.example.redline.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StructuralLabelTest {

    @Test
    void typePathReadsLevelsFromLabelShape() {
        List<StructuralLabel> path = StructuralLabel.typePath(List.of("c", "3", "A", "ii", "I"));

        assertThat(path)
                .extracting(StructuralLabel::level)
                .containsExactly(
                        StructuralLevel.SUBSECTION,
                        StructuralLevel.PARAGRAPH,
                        StructuralLevel.SUBPARAGRAPH,
                        StructuralLevel.CLAUSE,
                        StructuralLevel.SUBCLAUSE);
    }

    @Test
    void typePathStopsAtFirstOutOfOrderLabel() {
        List<StructuralLabel> path = StructuralLabel.typePath(List.of("c", "3", "4"));

        assertThat(path).hasSize(2);
    }

    @Test
    void singleRomanLetterDependsOnWhatPrecedesIt() {
        assertThat(StructuralLabel.classify("i", null, null).level()).isEqualTo(StructuralLevel.SUBSECTION);
        assertThat(StructuralLabel.classify("i", StructuralLevel.SUBPARAGRAPH, null).level())
                .isEqualTo(StructuralLevel.CLAUSE);
        assertThat(StructuralLabel.classify("iv", null, null).level()).isEqualTo(StructuralLevel.CLAUSE);
        assertThat(StructuralLabel.classify("v", null, StructuralLevel.CLAUSE).level())
                .isEqualTo(StructuralLevel.CLAUSE);
        assertThat(StructuralLabel.isAmbiguous("x")).isTrue();
        assertThat(StructuralLabel.isAmbiguous("ii")).isFalse();
    }

    @Test
    void successorFollowsEachNumberingScheme() {
        assertThat(StructuralLabel.nextLabel("9", StructuralLevel.PARAGRAPH)).isEqualTo("10");
        assertThat(StructuralLabel.nextLabel("h", StructuralLevel.SUBSECTION)).isEqualTo("i");
        assertThat(StructuralLabel.nextLabel("z", StructuralLevel.SUBSECTION)).isEqualTo("aa");
        assertThat(StructuralLabel.nextLabel("aa", StructuralLevel.SUBSECTION)).isEqualTo("bb");
        assertThat(StructuralLabel.nextLabel("Z", StructuralLevel.SUBPARAGRAPH)).isEqualTo("AA");
        assertThat(StructuralLabel.nextLabel("iv", StructuralLevel.CLAUSE)).isEqualTo("v");
        assertThat(StructuralLabel.nextLabel("VIII", StructuralLevel.SUBCLAUSE)).isEqualTo("IX");
    }

    @Test
    void romanConversionIsBounded() {
        assertThat(StructuralLabel.romanValue("xiv")).isEqualTo(14);
        assertThat(StructuralLabel.toRoman(49, false)).isEqualTo("xlix");
        assertThatThrownBy(() -> StructuralLabel.toRoman(100, false)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void levelKeywordsAcceptPlurals() {
        assertThat(StructuralLevel.fromKeyword("Subparagraphs")).contains(StructuralLevel.SUBPARAGRAPH);
        assertThat(StructuralLevel.fromKeyword("section")).isEmpty();
    }
}
