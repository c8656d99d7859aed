package com.example.redline.application.parse;

import com.example.redline.domain.AmendmentKind;
import com.example.redline.domain.AmendmentOperation;

import java.util.Optional;

/**
 * Recognizes one kind of amendment instruction. A rule that matches but finds the instruction
 * malformed returns an {@code unknown} operation, which ends classification.
 */
interface OperationRule {
    AmendmentKind kind();

    Optional<AmendmentOperation> match(InstructionClause clause);
}
