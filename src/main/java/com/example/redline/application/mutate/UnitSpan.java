package com.example.redline.application.mutate;

import com.example.redline.domain.StructuralLabel;

/**
 * Character range of a structural unit. {@code start} is the opening parenthesis of its marker,
 * {@code contentEnd} excludes trailing whitespace and {@code end} is where the next unit at the same
 * or a shallower level begins. The whole-text span has no label.
 */
public record UnitSpan(StructuralLabel label, int start, int markerEnd, int contentEnd, int end) {

    public boolean contains(int position) {
        return position >= start && position < end;
    }

    public boolean isWholeText() {
        return label == null;
    }
}
