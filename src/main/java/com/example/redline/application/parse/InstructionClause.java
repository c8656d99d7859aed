package com.example.redline.application.parse;

import java.util.List;

/**
 * One clause of an amendment instruction in masked form. {@code context} holds the masked text of the
 * enclosing clauses, whose locators ("in subsection (c)") apply to this one.
 */
record InstructionClause(
        String masked, QuotedText quotes, List<String> context, boolean lead, boolean hasChildren) {

    InstructionClause {
        context = List.copyOf(context);
    }

    String text() {
        return quotes.unmask(masked).strip();
    }

    String quote(int index) {
        return quotes.quote(index);
    }

    String unmask(String fragment) {
        return quotes.unmask(fragment);
    }
}
