package com.irisplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.irisplatform.common.exception.InvalidInputException;

/**
 * Summary statistics of one fixed-size latency window.
 *
 * <p>Produced outside the classifier (see
 * {@link com.irisplatform.common.stats.WindowStatsCalculator}) and immutable once
 * created. All values share the latency unit of the run (typically milliseconds).
 *
 * <ul>
 *   <li>{@code mean} — average latency, ≥ 0</li>
 *   <li>{@code std}  — standard deviation, ≥ 0; 0.0 when the window had fewer than 2 samples</li>
 *   <li>{@code p95}  — 95th-percentile latency, ≥ 0 (not necessarily ≥ mean)</li>
 * </ul>
 */
public record WindowStats(
    @JsonProperty("mean") double mean,
    @JsonProperty("std")  double std,
    @JsonProperty("p95")  double p95
) {
    public WindowStats {
        requireNonNegative("mean", mean);
        requireNonNegative("std", std);
        requireNonNegative("p95", p95);
    }

    public static WindowStats of(double mean, double std, double p95) {
        return new WindowStats(mean, std, p95);
    }

    private static void requireNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw InvalidInputException.invalidValue("WindowStats", field, value,
                "a finite value >= 0");
        }
    }
}
