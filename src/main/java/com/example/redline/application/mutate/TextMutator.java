package com.example.redline.application.mutate;

import com.example.redline.domain.AmendmentOperation;
import com.example.redline.domain.LabelPair;
import com.example.redline.domain.StructuralLabel;
import com.example.redline.domain.StructuralLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Applies an amendment operation to authoritative text. An operation that cannot be carried out
 * is reported as unresolved and the text comes back untouched; so does a chain in which any step
 * is unresolved.
 */
@Service
public class TextMutator {
    private static final Logger log = LogManager.getLogger(TextMutator.class);

    private static final Pattern STARTS_WITH_MARKER = Pattern.compile("^\\s*\\([A-Za-z0-9]{1,6}\\)");
    private static final String TIGHT_PUNCTUATION = ",.;:)";

    private final StructureLocator structureLocator;

    public TextMutator(StructureLocator structureLocator) {
        this.structureLocator = structureLocator;
    }

    public MutationOutcome apply(String text, AmendmentOperation operation) {
        MutationOutcome outcome = applySingle(text, operation);
        String current = outcome.amendedText();
        for (AmendmentOperation chained : operation.furtherAmendments()) {
            if (!outcome.resolved()) {
                break;
            }
            outcome = apply(current, chained);
            current = outcome.amendedText();
        }
        if (!outcome.resolved()) {
            log.debug("Unresolved {} operation: {}", operation.kind().code(), abbreviate(operation.instruction()));
            return MutationOutcome.unresolved(text);
        }
        return MutationOutcome.resolved(current);
    }

    private MutationOutcome applySingle(String text, AmendmentOperation op) {
        return switch (op.kind()) {
            case STRIKE_INSERT -> strikeInsert(text, op);
            case EACH_PLACE_APPEARS -> replaceEach(text, op, op.newText());
            case STRIKE -> strike(text, op);
            case INSERT_AFTER -> insertRelative(text, op, true);
            case INSERT_BEFORE -> insertRelative(text, op, false);
            case READ_AS_FOLLOWS -> readAsFollows(text, op);
            case ADD_AT_END -> addAtEnd(text, op);
            case ADD_AT_BEGINNING -> addAtBeginning(text, op);
            case REDESIGNATE -> unitScope(text, op)
                    .map(scope -> relabel(text, scope, op.labelMapping()))
                    .orElse(MutationOutcome.unresolved(text));
            case STRIKE_REDESIGNATE -> strikeRedesignate(text, op);
            case DESIGNATE -> designate(text, op);
            case FURTHER_AMENDED -> MutationOutcome.resolved(text);
            case UNKNOWN -> MutationOutcome.unresolved(text);
        };
    }

    private MutationOutcome strikeInsert(String text, AmendmentOperation op) {
        if (op.unitReference() != null) {
            if (op.newText().isBlank()) {
                return MutationOutcome.unresolved(text);
            }
            return unitScope(text, op)
                    .flatMap(scope -> structureLocator.locateWithin(text, scope, op.unitReference()))
                    .map(unit -> MutationOutcome.resolved(splice(text, unit.start(), unit.contentEnd(), op.newText().strip())))
                    .orElse(MutationOutcome.unresolved(text));
        }
        if (op.eachPlaceAppears()) {
            return replaceEach(text, op, op.newText());
        }
        if (op.oldTexts().isEmpty()) {
            return MutationOutcome.unresolved(text);
        }
        UnitSpan scope = literalScope(text, op);
        String old = op.oldTexts().get(0);
        int index = op.atEnd()
                ? findLast(text, old, scope.start(), scope.contentEnd())
                : findFirst(text, old, scope.start(), scope.contentEnd());
        if (index < 0) {
            return MutationOutcome.unresolved(text);
        }
        return MutationOutcome.resolved(splice(text, index, index + old.length(), op.newText()));
    }

    private MutationOutcome replaceEach(String text, AmendmentOperation op, String replacement) {
        if (op.oldTexts().isEmpty() || op.oldTexts().get(0).isEmpty()) {
            return MutationOutcome.unresolved(text);
        }
        String old = op.oldTexts().get(0);
        UnitSpan scope = literalScope(text, op);
        List<Integer> positions = findAll(text, old, scope.start(), scope.contentEnd());
        if (positions.isEmpty()) {
            return MutationOutcome.unresolved(text);
        }
        String result = text;
        for (int i = positions.size() - 1; i >= 0; i--) {
            int index = positions.get(i);
            result = splice(result, index, index + old.length(), replacement);
        }
        return MutationOutcome.resolved(result);
    }

    private MutationOutcome strike(String text, AmendmentOperation op) {
        if (op.unitReference() != null) {
            return unitScope(text, op)
                    .flatMap(scope -> structureLocator.locateWithin(text, scope, op.unitReference()))
                    .map(unit -> MutationOutcome.resolved(removeUnit(text, unit)))
                    .orElse(MutationOutcome.unresolved(text));
        }
        if (op.oldTexts().isEmpty()) {
            return MutationOutcome.unresolved(text);
        }
        String result = text;
        for (String old : op.oldTexts()) {
            UnitSpan scope = literalScope(result, op);
            int index = op.atEnd()
                    ? findLast(result, old, scope.start(), scope.contentEnd())
                    : findFirst(result, old, scope.start(), scope.contentEnd());
            if (index < 0) {
                return MutationOutcome.unresolved(text);
            }
            result = splice(result, index, index + old.length(), "");
        }
        return MutationOutcome.resolved(result);
    }

    private MutationOutcome insertRelative(String text, AmendmentOperation op, boolean after) {
        String payload = op.newText();
        if (payload.isBlank()) {
            return MutationOutcome.unresolved(text);
        }
        if (op.unitReference() != null) {
            Optional<UnitSpan> anchor = unitScope(text, op)
                    .flatMap(scope -> structureLocator.locateWithin(text, scope, op.unitReference()));
            if (anchor.isEmpty()) {
                return MutationOutcome.unresolved(text);
            }
            UnitSpan unit = anchor.get();
            String indent = indentationBefore(text, unit.start());
            String block = payload.strip();
            return MutationOutcome.resolved(after
                    ? splice(text, unit.contentEnd(), unit.contentEnd(), "\n" + indent + block)
                    : splice(text, unit.start(), unit.start(), block + "\n" + indent));
        }
        if (op.oldTexts().isEmpty()) {
            return MutationOutcome.unresolved(text);
        }
        String marker = op.oldTexts().get(0);
        UnitSpan scope = literalScope(text, op);
        int index = op.atEnd()
                ? findLast(text, marker, scope.start(), scope.contentEnd())
                : findFirst(text, marker, scope.start(), scope.contentEnd());
        if (index < 0) {
            return MutationOutcome.unresolved(text);
        }
        if (after) {
            int at = index + marker.length();
            boolean tight = Character.isWhitespace(payload.charAt(0))
                    || TIGHT_PUNCTUATION.indexOf(payload.charAt(0)) >= 0;
            return MutationOutcome.resolved(splice(text, at, at, (tight ? "" : " ") + payload));
        }
        boolean tight = Character.isWhitespace(payload.charAt(payload.length() - 1))
                || TIGHT_PUNCTUATION.indexOf(marker.charAt(0)) >= 0;
        return MutationOutcome.resolved(splice(text, index, index, payload + (tight ? "" : " ")));
    }

    private MutationOutcome readAsFollows(String text, AmendmentOperation op) {
        if (op.newText().isBlank()) {
            return MutationOutcome.unresolved(text);
        }
        if (op.targetPath().isEmpty()) {
            return MutationOutcome.resolved(op.newText().strip());
        }
        return unitScope(text, op)
                .map(unit -> MutationOutcome.resolved(splice(text, unit.start(), unit.contentEnd(), op.newText().strip())))
                .orElse(MutationOutcome.unresolved(text));
    }

    private MutationOutcome addAtEnd(String text, AmendmentOperation op) {
        if (op.newText().isBlank()) {
            return MutationOutcome.unresolved(text);
        }
        String payload = op.newText().strip();
        boolean newUnit = STARTS_WITH_MARKER.matcher(payload).find();
        return unitScope(text, op)
                .map(scope -> {
                    String separator = newUnit ? "\n" + childIndentation(text, scope) : " ";
                    return MutationOutcome.resolved(
                            splice(text, scope.contentEnd(), scope.contentEnd(), separator + payload));
                })
                .orElse(MutationOutcome.unresolved(text));
    }

    /** Indentation of the last unit one level below the scope, or of the scope itself when it has none. */
    private String childIndentation(String text, UnitSpan scope) {
        List<UnitMarker> inside = structureLocator.markersWithin(text, scope);
        if (inside.isEmpty()) {
            return scope.isWholeText() ? "" : indentationBefore(text, scope.start());
        }
        StructuralLevel shallowest = inside.stream()
                .map(marker -> marker.label().level())
                .min(Comparator.naturalOrder())
                .orElseThrow();
        UnitMarker last = null;
        for (UnitMarker marker : inside) {
            if (marker.label().level() == shallowest) {
                last = marker;
            }
        }
        return indentationBefore(text, last.start());
    }

    private MutationOutcome addAtBeginning(String text, AmendmentOperation op) {
        if (op.newText().isBlank()) {
            return MutationOutcome.unresolved(text);
        }
        String payload = op.newText().strip();
        String separator = STARTS_WITH_MARKER.matcher(payload).find() ? "\n" : " ";
        return unitScope(text, op)
                .map(scope -> {
                    int at = contentStart(text, scope);
                    return MutationOutcome.resolved(splice(text, at, at, payload + separator));
                })
                .orElse(MutationOutcome.unresolved(text));
    }

    private MutationOutcome strikeRedesignate(String text, AmendmentOperation op) {
        if (op.unitReference() == null) {
            return MutationOutcome.unresolved(text);
        }
        Optional<UnitSpan> struck = unitScope(text, op)
                .flatMap(scope -> structureLocator.locateWithin(text, scope, op.unitReference()));
        if (struck.isEmpty()) {
            return MutationOutcome.unresolved(text);
        }
        String remaining = removeUnit(text, struck.get());
        MutationOutcome outcome = unitScope(remaining, op)
                .map(scope -> relabel(remaining, scope, op.labelMapping()))
                .orElse(MutationOutcome.unresolved(remaining));
        return outcome.resolved() ? outcome : MutationOutcome.unresolved(text);
    }

    private MutationOutcome designate(String text, AmendmentOperation op) {
        if (!op.labelMapping().isEmpty()) {
            return unitScope(text, op)
                    .map(scope -> relabel(text, scope, op.labelMapping()))
                    .orElse(MutationOutcome.unresolved(text));
        }
        boolean precedingMatter = !op.oldTexts().isEmpty()
                && op.oldTexts().get(0).toLowerCase(Locale.ROOT).contains("preceding");
        if (op.unitReference() == null || !precedingMatter || op.newText().isBlank()) {
            return MutationOutcome.unresolved(text);
        }
        Optional<UnitSpan> scope = unitScope(text, op);
        if (scope.isEmpty() || structureLocator.locateWithin(text, scope.get(), op.unitReference()).isEmpty()) {
            return MutationOutcome.unresolved(text);
        }
        int at = contentStart(text, scope.get());
        return MutationOutcome.resolved(splice(text, at, at, op.newText().strip() + " "));
    }

    /** Renames every mapped marker in one pass, so (2)->(3) and (3)->(4) never collide. */
    private MutationOutcome relabel(String text, UnitSpan scope, List<LabelPair> mapping) {
        if (mapping.isEmpty()) {
            return MutationOutcome.unresolved(text);
        }
        List<UnitMarker> inside = structureLocator.markersWithin(text, scope);
        List<Replacement> replacements = new ArrayList<>();
        for (LabelPair pair : mapping) {
            Optional<UnitMarker> marker = findMarker(inside, pair.from());
            if (marker.isEmpty()) {
                return MutationOutcome.unresolved(text);
            }
            replacements.add(new Replacement(marker.get().start(), marker.get().end(), pair.to().marker()));
        }
        replacements.sort(Comparator.comparingInt(Replacement::start).reversed());
        StringBuilder sb = new StringBuilder(text);
        for (Replacement replacement : replacements) {
            sb.replace(replacement.start(), replacement.end(), replacement.text());
        }
        return MutationOutcome.resolved(sb.toString());
    }

    private Optional<UnitMarker> findMarker(List<UnitMarker> markers, StructuralLabel label) {
        Optional<UnitMarker> exact = markers.stream().filter(m -> m.label().equals(label)).findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return markers.stream().filter(m -> m.label().label().equals(label.label())).findFirst();
    }

    private Optional<UnitSpan> unitScope(String text, AmendmentOperation op) {
        return structureLocator.locate(text, op.targetPath());
    }

    /** Literal spans are searched in the addressed unit, or in the whole text when it is not found. */
    private UnitSpan literalScope(String text, AmendmentOperation op) {
        return unitScope(text, op).orElseGet(() -> structureLocator.whole(text));
    }

    private String removeUnit(String text, UnitSpan unit) {
        String result = text.substring(0, unit.start()) + text.substring(unit.end());
        return unit.end() >= text.length() ? result.stripTrailing() : result;
    }

    /** Replaces [start, end) and drops a doubled space left behind by a removal. */
    private String splice(String text, int start, int end, String replacement) {
        int from = start;
        if (replacement.isEmpty() && from > 0 && text.charAt(from - 1) == ' '
                && (end >= text.length() || text.charAt(end) == ' ' || TIGHT_PUNCTUATION.indexOf(text.charAt(end)) >= 0)) {
            from--;
        }
        return text.substring(0, from) + replacement + text.substring(end);
    }

    private int contentStart(String text, UnitSpan scope) {
        int at = scope.isWholeText() ? 0 : scope.markerEnd();
        while (at < text.length() && Character.isWhitespace(text.charAt(at))) {
            at++;
        }
        return at;
    }

    private String indentationBefore(String text, int position) {
        int lineStart = text.lastIndexOf('\n', position - 1) + 1;
        String prefix = text.substring(lineStart, position);
        return prefix.isBlank() ? prefix : "";
    }

    private int findFirst(String text, String needle, int from, int to) {
        int index = text.indexOf(needle, from);
        if (index >= 0 && index + needle.length() <= to) {
            return index;
        }
        for (int i = from; i + needle.length() <= to; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    private int findLast(String text, String needle, int from, int to) {
        int index = text.lastIndexOf(needle, to - needle.length());
        if (index >= from) {
            return index;
        }
        for (int i = to - needle.length(); i >= from; i--) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    private List<Integer> findAll(String text, String needle, int from, int to) {
        List<Integer> exact = scan(text, needle, from, to, false);
        return exact.isEmpty() ? scan(text, needle, from, to, true) : exact;
    }

    private List<Integer> scan(String text, String needle, int from, int to, boolean ignoreCase) {
        List<Integer> positions = new ArrayList<>();
        int i = from;
        while (i + needle.length() <= to) {
            if (text.regionMatches(ignoreCase, i, needle, 0, needle.length())) {
                positions.add(i);
                i += needle.length();
            } else {
                i++;
            }
        }
        return positions;
    }

    private static String abbreviate(String instruction) {
        return instruction.length() <= 120 ? instruction : instruction.substring(0, 117) + "...";
    }

    private record Replacement(int start, int end, String text) {}
}
