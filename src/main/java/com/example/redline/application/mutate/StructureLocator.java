package com.example.redline.application.mutate;

import com.example.redline.domain.StructuralLabel;
import com.example.redline.domain.StructuralLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds structural units in statute text. A parenthesized label opens a unit only at the start of a
 * line, after sentence punctuation or a dash, or directly after another unit-opening marker, so
 * cross-references like {@code paragraph (2)} are never taken for units.
 */
@Component
public class StructureLocator {
    private static final Pattern MARKER = Pattern.compile("\\(([A-Za-z0-9]{1,6})\\)");

    public List<UnitMarker> markers(String text) {
        List<UnitMarker> markers = new ArrayList<>();
        Map<StructuralLevel, String> lastLabel = new EnumMap<>(StructuralLevel.class);
        StructuralLevel current = null;
        int lastMarkerEnd = -1;
        Matcher matcher = MARKER.matcher(text);
        while (matcher.find()) {
            if (!opensUnit(text, matcher.start(), matcher.end(), lastMarkerEnd)) {
                continue;
            }
            String label = matcher.group(1);
            StructuralLevel level = levelOf(label, current, lastLabel);
            lastLabel.put(level, label);
            for (StructuralLevel deeper : StructuralLevel.values()) {
                if (deeper.isDeeperThan(level)) {
                    lastLabel.remove(deeper);
                }
            }
            current = level;
            lastMarkerEnd = matcher.end();
            markers.add(new UnitMarker(new StructuralLabel(level, label), matcher.start(), matcher.end()));
        }
        return markers;
    }

    public UnitSpan whole(String text) {
        return new UnitSpan(null, 0, 0, contentEnd(text, 0, text.length()), text.length());
    }

    /** The unit addressed by {@code path}, each label searched inside the previous one. */
    public Optional<UnitSpan> locate(String text, List<StructuralLabel> path) {
        UnitSpan scope = whole(text);
        if (path.isEmpty()) {
            return Optional.of(scope);
        }
        List<UnitMarker> markers = markers(text);
        for (StructuralLabel label : path) {
            Optional<UnitSpan> child = locateWithin(text, markers, scope, label);
            if (child.isEmpty()) {
                return Optional.empty();
            }
            scope = child.get();
        }
        return Optional.of(scope);
    }

    public Optional<UnitSpan> locateWithin(String text, UnitSpan scope, StructuralLabel label) {
        return locateWithin(text, markers(text), scope, label);
    }

    public boolean hasUnitStart(String text, String label) {
        return markers(text).stream().anyMatch(marker -> marker.label().label().equals(label));
    }

    /** Markers strictly inside {@code scope}, excluding the scope's own marker. */
    public List<UnitMarker> markersWithin(String text, UnitSpan scope) {
        List<UnitMarker> inside = new ArrayList<>();
        for (UnitMarker marker : markers(text)) {
            if (marker.start() >= scope.markerEnd() && marker.start() < scope.end()
                    && (scope.isWholeText() || marker.start() > scope.start())) {
                inside.add(marker);
            }
        }
        return inside;
    }

    public UnitSpan spanOf(String text, List<UnitMarker> markers, int index) {
        UnitMarker marker = markers.get(index);
        int end = text.length();
        for (int i = index + 1; i < markers.size(); i++) {
            if (!markers.get(i).label().level().isDeeperThan(marker.label().level())) {
                end = markers.get(i).start();
                break;
            }
        }
        return new UnitSpan(marker.label(), marker.start(), marker.end(), contentEnd(text, marker.start(), end), end);
    }

    private Optional<UnitSpan> locateWithin(
            String text, List<UnitMarker> markers, UnitSpan scope, StructuralLabel label) {
        int fallback = -1;
        for (int i = 0; i < markers.size(); i++) {
            UnitMarker marker = markers.get(i);
            if (marker.start() < scope.markerEnd() || marker.start() >= scope.end()
                    || (!scope.isWholeText() && marker.start() == scope.start())) {
                continue;
            }
            if (marker.label().equals(label)) {
                return Optional.of(spanOf(text, markers, i));
            }
            if (fallback < 0 && marker.label().label().equals(label.label())) {
                fallback = i;
            }
        }
        return fallback < 0 ? Optional.empty() : Optional.of(spanOf(text, markers, fallback));
    }

    private boolean opensUnit(String text, int start, int end, int lastMarkerEnd) {
        if (end < text.length()) {
            char next = text.charAt(end);
            if (!Character.isWhitespace(next) && next != '(') {
                return false;
            }
        }
        int i = start - 1;
        while (i >= 0 && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i--;
        }
        if (i < 0) {
            return true;
        }
        char previous = text.charAt(i);
        if (previous == ')') {
            return lastMarkerEnd == i + 1;
        }
        return previous == '\n' || previous == '\r' || previous == '—' || previous == '-'
                || previous == '.' || previous == ':' || previous == ';';
    }

    private StructuralLevel levelOf(String label, StructuralLevel current, Map<StructuralLevel, String> lastLabel) {
        char first = label.charAt(0);
        if (Character.isDigit(first)) {
            return StructuralLevel.PARAGRAPH;
        }
        boolean roman = StructuralLabel.isRoman(label);
        if (Character.isUpperCase(first)) {
            if (roman) {
                if (label.equals("I")) {
                    return current != null && !StructuralLevel.CLAUSE.isDeeperThan(current)
                            ? StructuralLevel.SUBCLAUSE
                            : StructuralLevel.SUBPARAGRAPH;
                }
                if (follows(lastLabel, StructuralLevel.SUBCLAUSE, label)) {
                    return StructuralLevel.SUBCLAUSE;
                }
                if (follows(lastLabel, StructuralLevel.SUBPARAGRAPH, label)) {
                    return StructuralLevel.SUBPARAGRAPH;
                }
                return label.length() > 1 ? StructuralLevel.SUBCLAUSE : StructuralLevel.SUBPARAGRAPH;
            }
            return StructuralLevel.SUBPARAGRAPH;
        }
        if (roman) {
            if (label.equals("i")) {
                if (current != null && !StructuralLevel.SUBPARAGRAPH.isDeeperThan(current)) {
                    return StructuralLevel.CLAUSE;
                }
                if ("h".equals(lastLabel.get(StructuralLevel.SUBSECTION))) {
                    return StructuralLevel.SUBSECTION;
                }
                return current == StructuralLevel.PARAGRAPH ? StructuralLevel.CLAUSE : StructuralLevel.SUBSECTION;
            }
            if (follows(lastLabel, StructuralLevel.CLAUSE, label)) {
                return StructuralLevel.CLAUSE;
            }
            if (follows(lastLabel, StructuralLevel.SUBSECTION, label)) {
                return StructuralLevel.SUBSECTION;
            }
            return label.length() > 1 ? StructuralLevel.CLAUSE : StructuralLevel.SUBSECTION;
        }
        return StructuralLevel.SUBSECTION;
    }

    private boolean follows(Map<StructuralLevel, String> lastLabel, StructuralLevel level, String label) {
        String previous = lastLabel.get(level);
        return previous != null && StructuralLabel.nextLabel(previous, level).equals(label);
    }

    private int contentEnd(String text, int from, int end) {
        int contentEnd = end;
        while (contentEnd > from && Character.isWhitespace(text.charAt(contentEnd - 1))) {
            contentEnd--;
        }
        return contentEnd;
    }
}
