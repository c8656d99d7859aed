package com.example.redline.application.parse;

import com.example.redline.domain.AmendmentKind;
import com.example.redline.domain.AmendmentOperation;
import com.example.redline.domain.LabelPair;
import com.example.redline.domain.StructuralLabel;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The classification rules in precedence order. The first rule that matches a clause decides its
 * kind. Patterns run on masked text, so quoted matter is only ever seen as a placeholder.
 */
final class OperationRules {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    static final String Q = QuotedText.PLACEHOLDER;
    static final String NOT_QUOTE = "[^" + QuotedText.OPEN + ";]";
    static final String UNIT = "(subsections?|paragraphs?|subparagraphs?|clauses?|subclauses?)";
    static final String LABEL = "\\(([A-Za-z0-9]{1,6})\\)";
    static final String LABEL_RUN = "((?:\\([A-Za-z0-9]{1,6}\\))+)";
    static final String LABEL_LIST =
            "(\\([A-Za-z0-9]{1,6}\\)(?:\\s*(?:,\\s*(?:and\\s+)?|and\\s+|through\\s+|to\\s+|-\\s*|—\\s*)\\([A-Za-z0-9]{1,6}\\))*)";
    static final String STRIKE_VERB = "\\b(?:strik(?:e|ing)(?:\\s+out)?|delet(?:e|ing))";
    static final String EACH_PLACE =
            "(?:each\\s+place\\s+(?:it|they|such\\s+\\w+|that\\s+\\w+|the\\s+\\w+)\\s+appears?"
                    + "|wherever\\s+(?:it|they|such\\s+\\w+)\\s+appears?)";
    static final String PUNCTUATION = "(period|comma|semicolon|colon)";
    static final String INSERTING =
            "\\s*,?\\s*and\\s+(?:by\\s+)?insert(?:ing)?\\s+(?:in\\s+(?:lieu|place)\\s+thereof\\s+)?(?:the\\s+following\\s*:?\\s*)?";

    private static final Pattern OPERATIVE_WORD =
            Pattern.compile("\\b(?:strik|insert|add|redesignat|designat)", Pattern.CASE_INSENSITIVE);
    private static final Pattern EACH_PLACE_PATTERN = Pattern.compile(EACH_PLACE, FLAGS);
    private static final Pattern AT_THE_END = Pattern.compile("\\bat\\s+the\\s+end\\b", FLAGS);
    private static final Pattern FOLLOWING_LEAD =
            Pattern.compile("^[\\s,]*(?:the\\s+following(?:\\s+new\\s+[a-z]+)?\\s*)?:?\\s*", FLAGS);
    private static final Pattern LEADING_QUOTE = Pattern.compile("^" + Q);
    private static final Pattern END_REFERENCE =
            Pattern.compile(
                    "^\\s*(?:thereof|of\\s+(?:the\\s+)?(?:such\\s+)?(?:" + UNIT + "\\s+" + LABEL_RUN
                            + "|section|title|such\\s+\\w+))?",
                    FLAGS);

    static final List<OperationRule> ORDERED =
            List.of(
                    new StrikeInsertRule(),
                    new StrikeRedesignateRule(),
                    new RedesignateRule(),
                    new DesignateRule(),
                    new InsertRelativeRule(AmendmentKind.INSERT_AFTER, "after"),
                    new InsertRelativeRule(AmendmentKind.INSERT_BEFORE, "before"),
                    new ReadAsFollowsRule(),
                    new AddAtEndRule(),
                    new AddAtBeginningRule(),
                    new EachPlaceAppearsRule(),
                    new StrikeRule(),
                    new FurtherAmendedRule());

    private OperationRules() {}

    static AmendmentOperation.AmendmentOperationBuilder operation(AmendmentKind kind) {
        return AmendmentOperation.builder().kind(kind);
    }

    static Pattern pattern(String regex) {
        return Pattern.compile(regex, FLAGS);
    }

    static String quote(InstructionClause clause, Matcher matcher, int group) {
        return clause.quote(Integer.parseInt(matcher.group(group)));
    }

    /** Payload that follows an instruction verb: a quotation, or the plain text that remains. */
    static String payload(InstructionClause clause, String maskedRest) {
        String rest = FOLLOWING_LEAD.matcher(maskedRest).replaceFirst("");
        Matcher quoted = LEADING_QUOTE.matcher(rest);
        if (quoted.find()) {
            return clause.quote(Integer.parseInt(quoted.group(1))).strip();
        }
        if (rest.matches("(?s)[\\p{Punct}\\s—]*")) {
            return "";
        }
        return clause.unmask(rest).replaceFirst("(?s)(?:\\s*[;,.]\\s*(?:and|or)?)?\\s*$", "").strip();
    }

    static String stripEndReference(String maskedRest) {
        return END_REFERENCE.matcher(maskedRest).replaceFirst("");
    }

    static boolean hasOperativeWord(String text) {
        return OPERATIVE_WORD.matcher(text).find();
    }

    static String punctuation(String word) {
        return switch (word.toLowerCase(Locale.ROOT)) {
            case "period" -> ".";
            case "comma" -> ",";
            case "semicolon" -> ";";
            default -> ":";
        };
    }

    /** The last label of a run is the unit acted on; the ones before it address its parent. */
    static AmendmentOperation.AmendmentOperationBuilder unitOperation(
            AmendmentKind kind, String unitWord, String run) {
        List<StructuralLabel> labels = LabelSequences.run(unitWord, run);
        return operation(kind)
                .unitReference(labels.get(labels.size() - 1))
                .targetPath(labels.subList(0, labels.size() - 1));
    }

    static Optional<AmendmentOperation> relabeling(
            AmendmentOperation.AmendmentOperationBuilder builder,
            String fromUnit,
            String fromList,
            String toUnit,
            String toList) {
        Optional<List<StructuralLabel>> from = LabelSequences.list(fromUnit, fromList);
        Optional<List<StructuralLabel>> to = LabelSequences.list(toUnit != null ? toUnit : fromUnit, toList);
        Optional<List<LabelPair>> pairs =
                from.isPresent() && to.isPresent()
                        ? LabelSequences.pair(from.get(), to.get())
                        : Optional.empty();
        if (pairs.isEmpty()) {
            return Optional.of(operation(AmendmentKind.UNKNOWN).build());
        }
        return Optional.of(builder.labelMapping(pairs.get()).build());
    }

    static final class StrikeInsertRule implements OperationRule {
        private static final Pattern LITERAL =
                pattern(STRIKE_VERB + "\\s+" + Q + "(" + NOT_QUOTE + "*?)" + INSERTING + Q);
        private static final Pattern PUNCTUATION_AT_END =
                pattern("\\bstriking\\s+(?:the\\s+)?" + PUNCTUATION + "\\s+at\\s+the\\s+end(" + NOT_QUOTE + "*?)"
                        + INSERTING + Q);
        private static final Pattern UNIT_REPLACEMENT =
                pattern("\\bstriking\\s+(?:the\\s+)?" + UNIT + "\\s+" + LABEL_RUN + "(" + NOT_QUOTE + "*?)"
                        + "\\s*,?\\s*and\\s+(?:by\\s+)?inserting\\b(.*)");
        private static final Pattern TRAILING_EACH_PLACE = pattern("^\\s*,?\\s*" + EACH_PLACE);

        @Override
        public AmendmentKind kind() {
            return AmendmentKind.STRIKE_INSERT;
        }

        @Override
        public Optional<AmendmentOperation> match(InstructionClause clause) {
            String text = clause.masked();
            Matcher literal = LITERAL.matcher(text);
            if (literal.find()) {
                String between = literal.group(2);
                if (!EACH_PLACE_PATTERN.matcher(between).find() && !hasOperativeWord(between)) {
                    return Optional.of(
                            operation(kind())
                                    .oldTexts(List.of(quote(clause, literal, 1)))
                                    .newText(quote(clause, literal, 3))
                                    .atEnd(AT_THE_END.matcher(between).find())
                                    .eachPlaceAppears(TRAILING_EACH_PLACE.matcher(text.substring(literal.end())).find())
                                    .build());
                }
            }
            Matcher punctuation = PUNCTUATION_AT_END.matcher(text);
            if (punctuation.find() && !hasOperativeWord(punctuation.group(2))) {
                return Optional.of(
                        operation(kind())
                                .oldTexts(List.of(punctuation(punctuation.group(1))))
                                .newText(quote(clause, punctuation, 3))
                                .atEnd(true)
                                .build());
            }
            Matcher unit = UNIT_REPLACEMENT.matcher(text);
            if (unit.find() && !hasOperativeWord(unit.group(3))) {
                return Optional.of(
                        unitOperation(kind(), unit.group(1), unit.group(2))
                                .newText(payload(clause, unit.group(4)))
                                .build());
            }
            return Optional.empty();
        }
    }

    static final class StrikeRedesignateRule implements OperationRule {
        private static final Pattern STRIKE_AND_REDESIGNATE =
                pattern("\\bstriking\\s+(?:the\\s+)?" + UNIT + "\\s+" + LABEL + "(" + NOT_QUOTE + "*?)"
                        + "\\s*[,;]?\\s*(?:and\\s+)?(?:by\\s+)?redesignating\\s+(?:the\\s+)?(?:" + UNIT + "\\s+)?"
                        + LABEL_LIST + "\\s+as\\s+(?:the\\s+)?(?:" + UNIT + "\\s+)?" + LABEL_LIST);

        @Override
        public AmendmentKind kind() {
            return AmendmentKind.STRIKE_REDESIGNATE;
        }

        @Override
        public Optional<AmendmentOperation> match(InstructionClause clause) {
            Matcher matcher = STRIKE_AND_REDESIGNATE.matcher(clause.masked());
            if (!matcher.find() || hasOperativeWord(matcher.group(3))) {
                return Optional.empty();
            }
            String fromUnit = matcher.group(4) != null ? matcher.group(4) : matcher.group(1);
            AmendmentOperation.AmendmentOperationBuilder builder =
                    operation(kind()).unitReference(LabelSequences.typed(matcher.group(1), matcher.group(2)));
            return relabeling(builder, fromUnit, matcher.group(5), matcher.group(6), matcher.group(7));
        }
    }

    static final class RedesignateRule implements OperationRule {
        private static final Pattern REDESIGNATE =
                pattern("\\bredesignating\\s+(?:the\\s+)?" + UNIT + "\\s+" + LABEL_LIST
                        + "\\s+as\\s+(?:the\\s+)?(?:" + UNIT + "\\s+)?" + LABEL_LIST);

        @Override
        public AmendmentKind kind() {
            return AmendmentKind.REDESIGNATE;
        }

        @Override
        public Optional<AmendmentOperation> match(InstructionClause clause) {
            Matcher matcher = REDESIGNATE.matcher(clause.masked());
            if (!matcher.find()) {
                return Optional.empty();
            }
            return relabeling(operation(kind()), matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4));
        }
    }

    static final class DesignateRule implements OperationRule {
        private static final Pattern DESIGNATE =
                pattern("\\bdesignating\\s+(.+?)\\s+as\\s+(?:a\\s+|an\\s+|new\\s+)*" + UNIT + "\\s+" + LABEL);
        private static final Pattern MATTER =
                pattern("^(?:the\\s+)?(?:undesignated\\s+)?(?:matter|text)\\s+(preceding|following)\\s+(?:"
                        + UNIT + "\\s+)?" + LABEL);
        private static final Pattern EXISTING_UNIT =
                pattern("^(?:the\\s+)?(?:existing\\s+)?" + UNIT + "\\s+" + LABEL + "\\s*$");

        @Override
        public AmendmentKind kind() {
            return AmendmentKind.DESIGNATE;
        }

        @Override
        public Optional<AmendmentOperation> match(InstructionClause clause) {
            Matcher matcher = DESIGNATE.matcher(clause.masked());
            if (!matcher.find()) {
                return Optional.empty();
            }
            String matter = matcher.group(1).strip();
            StructuralLabel designation = LabelSequences.typed(matcher.group(2), matcher.group(3));
            AmendmentOperation.AmendmentOperationBuilder builder =
                    operation(kind()).newText(designation.marker());
            Matcher existing = EXISTING_UNIT.matcher(matter);
            if (existing.find()) {
                StructuralLabel from = LabelSequences.typed(existing.group(1), existing.group(2));
                return Optional.of(builder.labelMapping(List.of(new LabelPair(from, designation))).build());
            }
            Matcher anchored = MATTER.matcher(matter);
            if (anchored.find()) {
                String anchorUnit = anchored.group(2) != null ? anchored.group(2) : matcher.group(2);
                return Optional.of(
                        builder.oldTexts(List.of(clause.unmask(matter)))
                                .unitReference(LabelSequences.typed(anchorUnit, anchored.group(3)))
                                .build());
            }
            return Optional.of(builder.oldTexts(List.of(clause.unmask(matter))).build());
        }
    }

    static final class InsertRelativeRule implements OperationRule {
        private final AmendmentKind kind;
        private final Pattern payloadThenAnchor;
        private final Pattern anchorThenPayload;
        private final Pattern punctuationAnchor;
        private final Pattern unitAnchor;

        InsertRelativeRule(AmendmentKind kind, String position) {
            this.kind = kind;
            String verb = "\\b(?:inserting|adding)\\s+(?:immediately\\s+)?" + position + "\\s+";
            this.payloadThenAnchor = pattern("\\binserting\\s+" + Q + "\\s+(?:immediately\\s+)?" + position + "\\s+" + Q);
            this.anchorThenPayload = pattern(verb + Q + "(.*)");
            this.punctuationAnchor =
                    pattern(verb + "(?:the\\s+)?" + PUNCTUATION + "\\s+at\\s+the\\s+end\\b(.*)");
            this.unitAnchor = pattern(verb + "(?:the\\s+)?" + UNIT + "\\s+" + LABEL_RUN + "(.*)");
        }

        @Override
        public AmendmentKind kind() {
            return kind;
        }

        @Override
        public Optional<AmendmentOperation> match(InstructionClause clause) {
            String text = clause.masked();
            Matcher matcher = payloadThenAnchor.matcher(text);
            if (matcher.find()) {
                return Optional.of(
                        operation(kind)
                                .oldTexts(List.of(quote(clause, matcher, 2)))
                                .newText(quote(clause, matcher, 1))
                                .build());
            }
            matcher = anchorThenPayload.matcher(text);
            if (matcher.find()) {
                return Optional.of(
                        operation(kind)
                                .oldTexts(List.of(quote(clause, matcher, 1)))
                                .newText(payload(clause, matcher.group(2)))
                                .build());
            }
            matcher = punctuationAnchor.matcher(text);
            if (matcher.find()) {
                return Optional.of(
                        operation(kind)
                                .oldTexts(List.of(punctuation(matcher.group(1))))
                                .atEnd(true)
                                .newText(payload(clause, stripEndReference(matcher.group(2))))
                                .build());
            }
            matcher = unitAnchor.matcher(text);
            if (matcher.find()) {
                return Optional.of(
                        unitOperation(kind, matcher.group(1), matcher.group(2))
                                .newText(payload(clause, stripEndReference(matcher.group(3))))
                                .build());
            }
            return Optional.empty();
        }
    }

    static final class ReadAsFollowsRule implements OperationRule {
        private static final Pattern READ_AS_FOLLOWS =
                pattern("\\b(?:amended\\s+to\\s+read|shall\\s+read|to\\s+read)\\s+as\\s+follows\\b(.*)");

        @Override
        public AmendmentKind kind() {
            return AmendmentKind.READ_AS_FOLLOWS;
        }

        @Override
        public Optional<AmendmentOperation> match(InstructionClause clause) {
            Matcher matcher = READ_AS_FOLLOWS.matcher(clause.masked());
            if (!matcher.find()) {
                return Optional.empty();
            }
            return Optional.of(operation(kind()).newText(payload(clause, matcher.group(1))).build());
        }
    }

    static final class AddAtEndRule implements OperationRule {
        private static final Pattern AT_END =
                pattern("\\b(?:adding|inserting)\\s+at\\s+the\\s+end\\b(.*)");
        private static final Pattern FOLLOWING_AT_END =
                pattern("\\badding\\s+the\\s+following(?:\\s+new\\s+[a-z]+)?\\s+at\\s+the\\s+end\\b(.*)");
        private static final Pattern ADDING_FOLLOWING =
                pattern("\\badding\\s+((?:the\\s+following|a\\s+new\\s+[a-z]+)\\b.*)");

        @Override
        public AmendmentKind kind() {
            return AmendmentKind.ADD_AT_END;
        }

        @Override
        public Optional<AmendmentOperation> match(InstructionClause clause) {
            String text = clause.masked();
            for (Pattern pattern : List.of(AT_END, FOLLOWING_AT_END)) {
                Matcher matcher = pattern.matcher(text);
                if (matcher.find()) {
                    return Optional.of(
                            operation(kind()).newText(payload(clause, stripEndReference(matcher.group(1)))).build());
                }
            }
            Matcher matcher = ADDING_FOLLOWING.matcher(text);
            if (matcher.find()) {
                String rest = matcher.group(1).replaceFirst("(?i)^a\\s+new\\s+[a-z]+\\s*", "");
                return Optional.of(operation(kind()).newText(payload(clause, rest)).build());
            }
            return Optional.empty();
        }
    }

    static final class AddAtBeginningRule implements OperationRule {
        private static final Pattern AT_BEGINNING =
                pattern("\\b(?:adding|inserting)\\s+(?:the\\s+following\\s+)?(?:at\\s+)?the\\s+beginning\\b(.*)");

        @Override
        public AmendmentKind kind() {
            return AmendmentKind.ADD_AT_BEGINNING;
        }

        @Override
        public Optional<AmendmentOperation> match(InstructionClause clause) {
            Matcher matcher = AT_BEGINNING.matcher(clause.masked());
            if (!matcher.find()) {
                return Optional.empty();
            }
            return Optional.of(
                    operation(kind()).newText(payload(clause, stripEndReference(matcher.group(1)))).build());
        }
    }

    static final class EachPlaceAppearsRule implements OperationRule {
        private static final Pattern STRIKE_AND_INSERT =
                pattern(STRIKE_VERB + "\\s+" + Q + "\\s*,?\\s*" + EACH_PLACE + "(" + NOT_QUOTE + "*?)" + INSERTING + Q);
        private static final Pattern STRIKE_ONLY =
                pattern(STRIKE_VERB + "\\s+" + Q + "\\s*,?\\s*" + EACH_PLACE);

        @Override
        public AmendmentKind kind() {
            return AmendmentKind.EACH_PLACE_APPEARS;
        }

        @Override
        public Optional<AmendmentOperation> match(InstructionClause clause) {
            Matcher matcher = STRIKE_AND_INSERT.matcher(clause.masked());
            if (matcher.find() && !hasOperativeWord(matcher.group(2))) {
                return Optional.of(
                        operation(kind())
                                .oldTexts(List.of(quote(clause, matcher, 1)))
                                .newText(quote(clause, matcher, 3))
                                .eachPlaceAppears(true)
                                .build());
            }
            matcher = STRIKE_ONLY.matcher(clause.masked());
            if (matcher.find()) {
                return Optional.of(
                        operation(kind())
                                .oldTexts(List.of(quote(clause, matcher, 1)))
                                .eachPlaceAppears(true)
                                .build());
            }
            return Optional.empty();
        }
    }

    static final class StrikeRule implements OperationRule {
        private static final Pattern LITERAL = pattern(STRIKE_VERB + "\\s+" + Q + "(" + NOT_QUOTE + "*)");
        private static final Pattern PUNCTUATION_AT_END =
                pattern("\\bstriking\\s+(?:the\\s+)?" + PUNCTUATION + "\\s+at\\s+the\\s+end\\b");
        private static final Pattern UNIT_STRIKE =
                pattern("\\b(?:striking|repealing)\\s+(?:the\\s+)?" + UNIT + "\\s+" + LABEL_RUN);
        private static final Pattern LEADING_AT_END = pattern("^\\s*,?\\s*at\\s+the\\s+end\\b");

        @Override
        public AmendmentKind kind() {
            return AmendmentKind.STRIKE;
        }

        @Override
        public Optional<AmendmentOperation> match(InstructionClause clause) {
            String text = clause.masked();
            Matcher matcher = LITERAL.matcher(text);
            if (matcher.find()) {
                return Optional.of(
                        operation(kind())
                                .oldTexts(List.of(quote(clause, matcher, 1)))
                                .atEnd(LEADING_AT_END.matcher(matcher.group(2)).find())
                                .build());
            }
            matcher = PUNCTUATION_AT_END.matcher(text);
            if (matcher.find()) {
                return Optional.of(
                        operation(kind()).oldTexts(List.of(punctuation(matcher.group(1)))).atEnd(true).build());
            }
            matcher = UNIT_STRIKE.matcher(text);
            if (matcher.find()) {
                return Optional.of(unitOperation(kind(), matcher.group(1), matcher.group(2)).build());
            }
            return Optional.empty();
        }
    }

    static final class FurtherAmendedRule implements OperationRule {
        private static final Pattern FURTHER_AMENDED = pattern("\\bfurther\\s+amended\\b");

        @Override
        public AmendmentKind kind() {
            return AmendmentKind.FURTHER_AMENDED;
        }

        @Override
        public Optional<AmendmentOperation> match(InstructionClause clause) {
            if (!FURTHER_AMENDED.matcher(clause.masked()).find()) {
                return Optional.empty();
            }
            return Optional.of(operation(kind()).build());
        }
    }
}
