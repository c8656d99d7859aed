package com.example.redline.application;

import com.example.redline.domain.AmendmentKind;
import com.example.redline.domain.EditScript;

public interface RedlineRenderer {
    Redline render(EditScript script, AmendmentKind kind);

    /** Views of one edit script. {@code inline} is wrapped in the comparison container. */
    record Redline(String inline, String originalSide, String amendedSide, String condensed) {}
}
