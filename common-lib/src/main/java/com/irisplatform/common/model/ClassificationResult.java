package com.irisplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable output of one classification run.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code label}      — winning pattern, {@code MIXED_TRANSITION} or {@code UNCERTAIN}</li>
 *   <li>{@code confidence} — {@link ConfidenceTier} of the label</li>
 *   <li>{@code ranking}    — every pattern with its score, best first; ties in fixed priority order</li>
 * </ul>
 *
 * <p>The full ranking is always present so callers can audit the runner-up evidence.
 */
public record ClassificationResult(
    @JsonProperty("label")      ClassificationLabel label,
    @JsonProperty("confidence") ConfidenceTier confidence,
    @JsonProperty("ranking")    List<RankedPattern> ranking
) {
    public ClassificationResult {
        ranking = List.copyOf(ranking);
    }

    public RankedPattern top() {
        return ranking.get(0);
    }
}
