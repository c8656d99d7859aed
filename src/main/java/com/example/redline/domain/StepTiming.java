package com.example.redline.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Elapsed time of one stage of a document run.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StepTiming {
    private String label;
    private double durationSeconds;
}
