package com.irisplatform.common.model;

/**
 * Degradation patterns the rubric knows how to score.
 *
 * <p>Declaration order is the tie-break priority: when two patterns score the same,
 * the one declared first ranks higher. A new pattern is appended at the position
 * that reflects its priority.
 */
public enum PatternType {
    SLOW_DRIFT,
    VARIANCE_EXPLOSION,
    TAIL_ONLY_DEGRADATION
}
