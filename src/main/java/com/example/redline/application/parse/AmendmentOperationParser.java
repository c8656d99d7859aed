package com.example.redline.application.parse;

import com.example.redline.application.InstructionNormalizer;
import com.example.redline.application.mutate.StructureLocator;
import com.example.redline.domain.AmendmentKind;
import com.example.redline.domain.AmendmentOperation;
import com.example.redline.domain.Citation;
import com.example.redline.domain.StructuralLabel;
import com.example.redline.domain.StructuralLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classifies the instruction text around a citation into an {@link AmendmentOperation}. Every
 * non-definitional citation yields exactly one operation, {@code unknown} when nothing matches.
 */
@Service
public class AmendmentOperationParser {
    private static final Logger log = LogManager.getLogger(AmendmentOperationParser.class);

    private final InstructionNormalizer normalizer;
    private final StructureLocator structureLocator;

    public AmendmentOperationParser(InstructionNormalizer normalizer, StructureLocator structureLocator) {
        this.normalizer = normalizer;
        this.structureLocator = structureLocator;
    }

    /** Rule kinds in the order they are tried. */
    public static List<AmendmentKind> precedence() {
        return OperationRules.ORDERED.stream().map(OperationRule::kind).toList();
    }

    public Optional<AmendmentOperation> parse(Citation citation, String context, String authoritativeText) {
        if (citation.definitional()) {
            return Optional.empty();
        }
        String normalized = normalizer.normalize(context);
        List<StructuralLabel> basePath = disambiguate(citation.address().path(), authoritativeText);
        List<InstructionClause> clauses = ClauseSplitter.split(QuotedText.mask(normalized));

        List<AmendmentOperation> operations = new ArrayList<>();
        for (InstructionClause clause : clauses) {
            AmendmentOperation classified = classify(clause);
            if (classified.kind() == AmendmentKind.UNKNOWN && (clause.hasChildren() || (clause.lead() && clauses.size() > 1))) {
                continue;
            }
            operations.add(
                    classified.toBuilder()
                            .targetPath(TargetPathResolver.resolve(basePath, clause, classified.targetPath()))
                            .instruction(clause.text())
                            .build());
        }
        if (operations.isEmpty()) {
            log.debug("No operation recognized for {}", citation.rawText());
            return Optional.of(AmendmentOperation.unknown(normalized.strip(), basePath));
        }
        AmendmentOperation primary = operations.get(0);
        return Optional.of(primary.withFurtherAmendments(operations.subList(1, operations.size())));
    }

    public Optional<AmendmentOperation> parse(Citation citation, String context) {
        return parse(citation, context, null);
    }

    AmendmentOperation classify(InstructionClause clause) {
        for (OperationRule rule : OperationRules.ORDERED) {
            Optional<AmendmentOperation> matched = rule.match(clause);
            if (matched.isPresent()) {
                return matched.get();
            }
        }
        return AmendmentOperation.builder().kind(AmendmentKind.UNKNOWN).build();
    }

    /**
     * A leading {@code (i)}, {@code (v)} or {@code (x)} is a subsection only when the statute has a
     * subsection marker for the preceding letter; otherwise it is a clause.
     */
    private List<StructuralLabel> disambiguate(List<StructuralLabel> path, String authoritativeText) {
        if (path.isEmpty() || authoritativeText == null || authoritativeText.isEmpty()) {
            return path;
        }
        StructuralLabel first = path.get(0);
        if (first.level() != StructuralLevel.SUBSECTION || !StructuralLabel.isAmbiguous(first.label())) {
            return path;
        }
        String precedingLetter = String.valueOf((char) (first.label().charAt(0) - 1));
        if (structureLocator.hasUnitStart(authoritativeText, precedingLetter)) {
            return path;
        }
        List<StructuralLabel> retyped = new ArrayList<>();
        retyped.add(new StructuralLabel(StructuralLevel.CLAUSE, first.label()));
        StructuralLevel previous = StructuralLevel.CLAUSE;
        for (StructuralLabel label : path.subList(1, path.size())) {
            StructuralLabel typed = StructuralLabel.classify(label.label(), previous, null);
            if (!typed.level().isDeeperThan(previous)) {
                break;
            }
            retyped.add(typed);
            previous = typed.level();
        }
        return retyped;
    }
}
