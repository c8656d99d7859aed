package com.example.redline.application.parse;

import com.example.redline.domain.StructuralLabel;
import com.example.redline.domain.StructuralLevel;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Refines a citation's path with the locators of an instruction: "in subparagraph (D)",
 * "paragraph (2) of subsection (b)", "subsection (c) is amended".
 */
final class TargetPathResolver {
    private static final String UNIT = "(subsections?|paragraphs?|subparagraphs?|clauses?|subclauses?)";
    private static final String LABEL_RUN = "((?:\\([A-Za-z0-9]{1,6}\\))+)";

    private static final Pattern PREPOSITIONAL =
            Pattern.compile(
                    "\\b(?:in|of|within|to)\\s+(?:the\\s+)?(?:such\\s+)?" + UNIT + "\\s+" + LABEL_RUN,
                    Pattern.CASE_INSENSITIVE);
    private static final Pattern SUBJECT =
            Pattern.compile(
                    "\\b" + UNIT + "\\s+" + LABEL_RUN
                            + "(?:\\s+of\\s+(?:such|that|this)\\s+\\w+|\\s+thereof)?\\s*,?\\s+(?:is|are)\\s+(?:further\\s+)?amended",
                    Pattern.CASE_INSENSITIVE);

    private TargetPathResolver() {}

    static List<StructuralLabel> resolve(
            List<StructuralLabel> citationPath, InstructionClause clause, List<StructuralLabel> operationLabels) {
        Map<StructuralLevel, StructuralLabel> refinements = new EnumMap<>(StructuralLevel.class);
        for (String context : clause.context()) {
            collect(context, refinements);
        }
        collect(clause.masked(), refinements);
        for (StructuralLabel label : operationLabels) {
            refinements.put(label.level(), label);
        }

        List<StructuralLabel> path = new ArrayList<>(citationPath);
        for (StructuralLabel refinement : refinements.values()) {
            path.removeIf(existing -> !refinement.level().isDeeperThan(existing.level()));
            path.add(refinement);
        }
        return path;
    }

    private static void collect(String masked, Map<StructuralLevel, StructuralLabel> refinements) {
        List<int[]> seen = new ArrayList<>();
        for (Pattern pattern : List.of(SUBJECT, PREPOSITIONAL)) {
            Matcher matcher = pattern.matcher(masked);
            while (matcher.find()) {
                int start = matcher.start(1);
                if (seen.stream().anyMatch(range -> start >= range[0] && start < range[1])) {
                    continue;
                }
                seen.add(new int[] {matcher.start(1), matcher.end(2)});
                for (StructuralLabel label : LabelSequences.run(matcher.group(1), matcher.group(2))) {
                    refinements.put(label.level(), label);
                }
            }
        }
    }
}
