package com.irisplatform.common.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Final label of a classification run: one of the scored patterns, or one of the two
 * inconclusive outcomes.
 *
 * <p>Each label carries a short operator-facing interpretation.
 */
public enum ClassificationLabel {
    SLOW_DRIFT("Gradual, persistent performance degradation."),
    VARIANCE_EXPLOSION("Latency variability is multiplying without a sustained shift in the mean."),
    TAIL_ONLY_DEGRADATION("High-percentile latency is worsening while mean and variability stay stable."),
    MIXED_TRANSITION("Two degradation patterns are nearly equally well supported."),
    UNCERTAIN("No degradation pattern is well supported.");

    private static final Map<PatternType, ClassificationLabel> BY_PATTERN = new EnumMap<>(PatternType.class);

    static {
        for (PatternType pattern : PatternType.values()) {
            BY_PATTERN.put(pattern, ClassificationLabel.valueOf(pattern.name()));
        }
    }

    private final String interpretation;

    ClassificationLabel(String interpretation) {
        this.interpretation = interpretation;
    }

    public String interpretation() {
        return interpretation;
    }

    /** Label naming the given pattern directly. */
    public static ClassificationLabel fromPattern(PatternType pattern) {
        return BY_PATTERN.get(pattern);
    }

    public boolean isConclusive() {
        return this != MIXED_TRANSITION && this != UNCERTAIN;
    }
}
