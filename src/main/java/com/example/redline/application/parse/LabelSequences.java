package com.example.redline.application.parse;

import com.example.redline.domain.LabelPair;
import com.example.redline.domain.StructuralLabel;
import com.example.redline.domain.StructuralLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Reads label runs, lists and ranges such as {@code (2) through (4)} or {@code (C), (D), and (E)}. */
final class LabelSequences {
    private static final Pattern LABEL = Pattern.compile("\\(([A-Za-z0-9]{1,6})\\)");
    private static final Pattern RANGE_CONNECTOR =
            Pattern.compile("\\s*(?:through|to|-|—)\\s*", Pattern.CASE_INSENSITIVE);
    private static final int MAX_RANGE = 100;

    private LabelSequences() {}

    static StructuralLabel typed(String unitWord, String raw) {
        return StructuralLabel.classify(raw, null, StructuralLevel.fromKeyword(unitWord).orElse(null));
    }

    /** A run like {@code (b)(2)}: the first label takes the unit keyword, the rest nest below it. */
    static List<StructuralLabel> run(String unitWord, String run) {
        List<StructuralLabel> labels = new ArrayList<>();
        Matcher matcher = LABEL.matcher(run);
        StructuralLevel previous = null;
        while (matcher.find()) {
            StructuralLabel label = labels.isEmpty()
                    ? typed(unitWord, matcher.group(1))
                    : StructuralLabel.classify(matcher.group(1), previous, null);
            if (!label.level().isDeeperThan(previous)) {
                break;
            }
            labels.add(label);
            previous = label.level();
        }
        return labels;
    }

    /** Expands a list with optional ranges. Empty when a range cannot be walked. */
    static Optional<List<StructuralLabel>> list(String unitWord, String listText) {
        StructuralLevel hint = StructuralLevel.fromKeyword(unitWord).orElse(null);
        List<StructuralLabel> labels = new ArrayList<>();
        Matcher matcher = LABEL.matcher(listText);
        int previousEnd = -1;
        while (matcher.find()) {
            StructuralLevel level = labels.isEmpty() ? hint : labels.get(0).level();
            StructuralLabel label = StructuralLabel.classify(matcher.group(1), null, level);
            boolean range = previousEnd >= 0
                    && RANGE_CONNECTOR.matcher(listText.substring(previousEnd, matcher.start())).matches();
            if (range) {
                Optional<List<StructuralLabel>> expanded = expand(labels.get(labels.size() - 1), label);
                if (expanded.isEmpty()) {
                    return Optional.empty();
                }
                labels.addAll(expanded.get());
            } else {
                labels.add(label);
            }
            previousEnd = matcher.end();
        }
        return Optional.of(labels);
    }

    /** Pairs two lists element-wise. Empty when their lengths differ. */
    static Optional<List<LabelPair>> pair(List<StructuralLabel> from, List<StructuralLabel> to) {
        if (from.isEmpty() || from.size() != to.size()) {
            return Optional.empty();
        }
        List<LabelPair> pairs = new ArrayList<>(from.size());
        for (int i = 0; i < from.size(); i++) {
            pairs.add(new LabelPair(from.get(i), to.get(i)));
        }
        return Optional.of(pairs);
    }

    /** Labels after {@code first} up to and including {@code last}. */
    private static Optional<List<StructuralLabel>> expand(StructuralLabel first, StructuralLabel last) {
        List<StructuralLabel> expanded = new ArrayList<>();
        StructuralLabel current = first;
        try {
            for (int i = 0; i < MAX_RANGE; i++) {
                current = current.successor();
                expanded.add(current);
                if (current.label().equals(last.label())) {
                    return Optional.of(expanded);
                }
            }
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
        return Optional.empty();
    }
}
