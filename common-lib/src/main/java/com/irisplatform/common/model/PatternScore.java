package com.irisplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.irisplatform.common.exception.InvalidInputException;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Integer rubric score per {@link PatternType} for one run.
 *
 * <p>Scores are only comparable within a run. The mapping is copied on construction
 * and exposed read-only; completeness is checked by
 * {@link com.irisplatform.common.resolver.PatternResolver}, not here, so incomplete
 * maps can still be represented and rejected at resolution time. A {@code null} key
 * cannot be held at all and is rejected on construction.
 */
public record PatternScore(
    @JsonProperty("scores") Map<PatternType, Integer> scores
) {
    public PatternScore {
        Map<PatternType, Integer> copy = new EnumMap<>(PatternType.class);
        if (scores != null) {
            for (Map.Entry<PatternType, Integer> entry : scores.entrySet()) {
                if (entry.getKey() == null) {
                    throw InvalidInputException.invalidValue("PatternScore", "pattern key", null,
                        "one of " + Arrays.toString(PatternType.values()));
                }
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        scores = Collections.unmodifiableMap(copy);
    }

    public static PatternScore of(Map<PatternType, Integer> scores) {
        return new PatternScore(scores);
    }

    /** @return score of {@code pattern}, or {@code null} when absent */
    public Integer get(PatternType pattern) {
        return scores.get(pattern);
    }
}
