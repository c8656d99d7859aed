package com.example.redline.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One typed label of a structural path, e.g. paragraph {@code (3)} or clause {@code (ii)}.
 */
public record StructuralLabel(StructuralLevel level, String label) {
    private static final Pattern ROMAN =
            Pattern.compile("(?i)(?=[ivxl])(xl|l?x{0,3})(ix|iv|v?i{0,3})");
    private static final String[] ROMAN_TENS = {"", "x", "xx", "xxx", "xl", "l", "lx", "lxx", "lxxx", "xc"};
    private static final String[] ROMAN_UNITS = {"", "i", "ii", "iii", "iv", "v", "vi", "vii", "viii", "ix"};

    public StructuralLabel {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(label, "label");
    }

    public String marker() {
        return "(" + label + ")";
    }

    public StructuralLabel relabel(String newLabel) {
        return new StructuralLabel(level, newLabel);
    }

    @Override
    public String toString() {
        return level.keyword() + " " + marker();
    }

    /**
     * Types a bare label from its shape. A single {@code i}, {@code v} or {@code x} is read as a
     * clause only when a paragraph or deeper level precedes it; callers with access to the
     * authoritative text should settle that case through {@link #isAmbiguous(String)}.
     */
    public static StructuralLabel classify(String label, StructuralLevel previous, StructuralLevel hint) {
        if (hint != null && hint.accepts(label)) {
            return new StructuralLabel(hint, label);
        }
        char first = label.charAt(0);
        if (Character.isDigit(first)) {
            return new StructuralLabel(StructuralLevel.PARAGRAPH, label);
        }
        boolean roman = isRoman(label);
        if (Character.isUpperCase(first)) {
            if (roman && (label.length() > 1 || (previous != null && !StructuralLevel.CLAUSE.isDeeperThan(previous)))) {
                return new StructuralLabel(StructuralLevel.SUBCLAUSE, label);
            }
            return new StructuralLabel(StructuralLevel.SUBPARAGRAPH, label);
        }
        if (roman && (label.length() > 1 || (previous != null && previous != StructuralLevel.SUBSECTION))) {
            return new StructuralLabel(StructuralLevel.CLAUSE, label);
        }
        return new StructuralLabel(StructuralLevel.SUBSECTION, label);
    }

    /**
     * Types a run of raw labels such as {@code c, 3, A}. The path stops at the first label whose
     * level is not strictly deeper than the one before it.
     */
    public static List<StructuralLabel> typePath(List<String> rawLabels) {
        List<StructuralLabel> path = new ArrayList<>();
        StructuralLevel previous = null;
        for (String raw : rawLabels) {
            StructuralLabel typed = classify(raw, previous, null);
            if (!typed.level().isDeeperThan(previous)) {
                break;
            }
            path.add(typed);
            previous = typed.level();
        }
        return path;
    }

    public static boolean isRoman(String label) {
        return label != null && !label.isEmpty() && ROMAN.matcher(label).matches()
                && (label.equals(label.toLowerCase(Locale.ROOT)) || label.equals(label.toUpperCase(Locale.ROOT)));
    }

    /** Single letters that read both as a subsection and as a clause. */
    public static boolean isAmbiguous(String label) {
        return label.length() == 1 && "ivx".indexOf(label.charAt(0)) >= 0;
    }

    public static int romanValue(String label) {
        String lower = label.toLowerCase(Locale.ROOT);
        int total = 0;
        for (int i = 0; i < lower.length(); i++) {
            int value = romanDigit(lower.charAt(i));
            if (i + 1 < lower.length() && romanDigit(lower.charAt(i + 1)) > value) {
                total -= value;
            } else {
                total += value;
            }
        }
        return total;
    }

    public static String toRoman(int value, boolean upperCase) {
        if (value <= 0 || value >= 100) {
            throw new IllegalArgumentException("Roman label out of range: " + value);
        }
        String roman = ROMAN_TENS[value / 10] + ROMAN_UNITS[value % 10];
        return upperCase ? roman.toUpperCase(Locale.ROOT) : roman;
    }

    /** The label that follows this one at the same level: 3 -> 4, h -> i, z -> aa, iv -> v. */
    public StructuralLabel successor() {
        return new StructuralLabel(level, nextLabel(label, level));
    }

    public static String nextLabel(String label, StructuralLevel level) {
        if (level == StructuralLevel.CLAUSE || level == StructuralLevel.SUBCLAUSE) {
            return toRoman(romanValue(label) + 1, Character.isUpperCase(label.charAt(0)));
        }
        if (label.chars().allMatch(Character::isDigit)) {
            return Integer.toString(Integer.parseInt(label) + 1);
        }
        char last = label.charAt(label.length() - 1);
        boolean repeated = label.chars().allMatch(c -> c == last);
        if (repeated && Character.isLetter(last)) {
            if (last == 'z' || last == 'Z') {
                return String.valueOf((char) (last - 25)).repeat(label.length() + 1);
            }
            return String.valueOf((char) (last + 1)).repeat(label.length());
        }
        return label.substring(0, label.length() - 1) + (char) (last + 1);
    }

    private static int romanDigit(char c) {
        return switch (c) {
            case 'i' -> 1;
            case 'v' -> 5;
            case 'x' -> 10;
            case 'l' -> 50;
            default -> 0;
        };
    }
}
