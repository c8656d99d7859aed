package com.example.redline.application.parse;

import com.example.redline.domain.StructuralLabel;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a masked instruction into its lead clause, its enumerated items ({@code (1) by ...},
 * {@code (A) in ...}), the clauses that follow an "is further amended" marker and the compound
 * edits joined by {@code , and by striking ...}.
 */
final class ClauseSplitter {
    private static final Pattern ITEM =
            Pattern.compile(
                    "\\((\\d{1,3}|[A-Z]{1,4}|[a-z]{1,5})\\)\\s+(?=(?i:by|in|on|at|with\\s+respect\\s+to"
                            + "|striking|inserting|adding|redesignating|designating)\\b)");
    private static final Pattern FURTHER_AMENDED =
            Pattern.compile("(?:,\\s*)?\\b(?:and\\s+)?(?:is|are)\\s+further\\s+amended\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern OPERATIVE =
            Pattern.compile(
                    "\\b(?:strik|insert|add|redesignat|designat|delet|amended\\s+to\\s+read|read\\s+as\\s+follows)",
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPOUND =
            Pattern.compile(
                    "[,;]\\s*and\\s+by\\s+(?=(?:striking|inserting|adding|redesignating|deleting)\\b)",
                    Pattern.CASE_INSENSITIVE);

    private static final int LEAD_LEVEL = 0;

    private ClauseSplitter() {}

    static List<InstructionClause> split(QuotedText quoted) {
        String masked = quoted.masked();
        TreeMap<Integer, Integer> cuts = new TreeMap<>();
        Matcher item = ITEM.matcher(masked);
        int previousItemLevel = LEAD_LEVEL;
        while (item.find()) {
            if (!followsBreak(masked, item.start())) {
                continue;
            }
            int level = itemLevel(item.group(1), previousItemLevel);
            cuts.put(item.start(), level);
            previousItemLevel = level;
        }
        Matcher further = FURTHER_AMENDED.matcher(masked);
        while (further.find()) {
            Integer previousCut = cuts.floorKey(further.start());
            int segmentStart = previousCut == null ? 0 : previousCut;
            if (OPERATIVE.matcher(masked.substring(segmentStart, further.start())).find()) {
                cuts.put(further.start(), LEAD_LEVEL);
            }
        }

        List<Integer> starts = new ArrayList<>(cuts.keySet());
        List<Integer> levels = new ArrayList<>(cuts.values());
        List<InstructionClause> clauses = new ArrayList<>();
        int firstCut = starts.isEmpty() ? masked.length() : starts.get(0);
        String lead = masked.substring(0, firstCut);
        boolean leadHasChildren = !starts.isEmpty() && levels.get(0) > LEAD_LEVEL;
        if (!lead.isBlank() || starts.isEmpty()) {
            clauses.add(new InstructionClause(lead, quoted, List.of(), true, leadHasChildren));
        }

        Deque<int[]> open = new ArrayDeque<>();
        String currentLead = lead;
        for (int i = 0; i < starts.size(); i++) {
            int start = starts.get(i);
            int end = i + 1 < starts.size() ? starts.get(i + 1) : masked.length();
            int level = levels.get(i);
            String segment = masked.substring(start, end);
            boolean hasChildren = i + 1 < starts.size() && levels.get(i + 1) > level;
            if (level == LEAD_LEVEL) {
                open.clear();
                currentLead = segment;
                clauses.add(new InstructionClause(segment, quoted, List.of(), true, hasChildren));
                continue;
            }
            while (!open.isEmpty() && open.peek()[0] >= level) {
                open.pop();
            }
            List<String> context = new ArrayList<>();
            context.add(currentLead);
            open.descendingIterator().forEachRemaining(
                    ancestor -> context.add(masked.substring(ancestor[1], ancestor[2])));
            clauses.add(new InstructionClause(segment, quoted, context, false, hasChildren));
            open.push(new int[] {level, start, end});
        }

        List<InstructionClause> expanded = new ArrayList<>();
        for (InstructionClause clause : clauses) {
            expanded.addAll(splitCompound(clause));
        }
        return expanded;
    }

    /**
     * Cuts a clause before each {@code , and by <verb>} that follows an operative verb. The edits after
     * the first see the text before them as context, so its locators still apply.
     */
    private static List<InstructionClause> splitCompound(InstructionClause clause) {
        if (clause.hasChildren()) {
            return List.of(clause);
        }
        String masked = clause.masked();
        List<Integer> cuts = new ArrayList<>();
        Matcher compound = COMPOUND.matcher(masked);
        while (compound.find()) {
            int segmentStart = cuts.isEmpty() ? 0 : cuts.get(cuts.size() - 1);
            if (OPERATIVE.matcher(masked.substring(segmentStart, compound.start())).find()) {
                cuts.add(compound.start());
            }
        }
        if (cuts.isEmpty()) {
            return List.of(clause);
        }
        List<InstructionClause> parts = new ArrayList<>();
        String first = masked.substring(0, cuts.get(0));
        parts.add(new InstructionClause(first, clause.quotes(), clause.context(), clause.lead(), false));
        List<String> context = new ArrayList<>(clause.context());
        context.add(first);
        for (int i = 0; i < cuts.size(); i++) {
            int end = i + 1 < cuts.size() ? cuts.get(i + 1) : masked.length();
            parts.add(new InstructionClause(masked.substring(cuts.get(i), end), clause.quotes(), context, false, false));
        }
        return parts;
    }

    private static int itemLevel(String marker, int previousLevel) {
        if (Character.isDigit(marker.charAt(0))) {
            return 1;
        }
        boolean roman = StructuralLabel.isRoman(marker);
        if (Character.isUpperCase(marker.charAt(0))) {
            return roman && (marker.length() > 1 || previousLevel >= 3) ? 4 : 2;
        }
        return roman ? 3 : 1;
    }

    /** Items start a line or follow a dash, colon or semicolon ("; and (B) by adding ..."). */
    private static boolean followsBreak(String text, int position) {
        int i = position - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            if (text.charAt(i) == '\n') {
                return true;
            }
            i--;
        }
        if (i < 0) {
            return true;
        }
        char previous = text.charAt(i);
        if (previous == '—' || previous == ':' || previous == ';' || previous == '-') {
            return true;
        }
        int wordEnd = i + 1;
        while (i >= 0 && Character.isLetter(text.charAt(i))) {
            i--;
        }
        String word = text.substring(i + 1, wordEnd);
        if (!word.equals("and") && !word.equals("or")) {
            return false;
        }
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        return i >= 0 && (text.charAt(i) == ';' || text.charAt(i) == ',');
    }
}
