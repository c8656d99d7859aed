package com.example.redline.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Levels below a section, outermost first. Declaration order is the nesting order.
 */
public enum StructuralLevel {
    SUBSECTION("subsection"),
    PARAGRAPH("paragraph"),
    SUBPARAGRAPH("subparagraph"),
    CLAUSE("clause"),
    SUBCLAUSE("subclause");

    private final String keyword;

    StructuralLevel(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isDeeperThan(StructuralLevel other) {
        return other == null || ordinal() > other.ordinal();
    }

    /** Whether a label of this shape can stand at this level. */
    public boolean accepts(String label) {
        if (label == null || label.isEmpty()) {
            return false;
        }
        char first = label.charAt(0);
        return switch (this) {
            case SUBSECTION -> Character.isLowerCase(first);
            case PARAGRAPH -> Character.isDigit(first);
            case SUBPARAGRAPH -> Character.isUpperCase(first);
            case CLAUSE -> StructuralLabel.isRoman(label) && Character.isLowerCase(first);
            case SUBCLAUSE -> StructuralLabel.isRoman(label) && Character.isUpperCase(first);
        };
    }

    /** Maps "paragraph", "paragraphs", "Subclause" and the like to a level. */
    public static Optional<StructuralLevel> fromKeyword(String word) {
        if (word == null) {
            return Optional.empty();
        }
        String normalized = word.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("s")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        for (StructuralLevel level : values()) {
            if (level.keyword.equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
