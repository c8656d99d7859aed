package com.example.redline.application.mutate;

import com.example.redline.domain.StructuralLabel;

/** A marker such as {@code (3)} that opens a structural unit; {@code end} is just past the ')'. */
public record UnitMarker(StructuralLabel label, int start, int end) {}
