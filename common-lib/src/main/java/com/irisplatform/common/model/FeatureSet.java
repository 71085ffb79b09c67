package com.irisplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Trend and stability features derived once per classification run from an
 * ordered sequence of {@link WindowStats}.
 *
 * <p>{@code means}, {@code stds} and {@code p95s} keep window order; index 0 is the
 * oldest window. Deltas are {@code max - min} over the whole run, trend flags are
 * "non-decreasing within slack", and {@code stdGrowth} is last-window std over
 * first-window std.
 */
public record FeatureSet(
    @JsonProperty("means")       List<Double> means,
    @JsonProperty("stds")        List<Double> stds,
    @JsonProperty("p95s")        List<Double> p95s,
    @JsonProperty("meanDelta")   double meanDelta,
    @JsonProperty("stdDelta")    double stdDelta,
    @JsonProperty("p95Delta")    double p95Delta,
    @JsonProperty("meanTrendUp") boolean meanTrendUp,
    @JsonProperty("p95TrendUp")  boolean p95TrendUp,
    @JsonProperty("stdGrowth")   double stdGrowth
) {
    public FeatureSet {
        means = List.copyOf(means);
        stds  = List.copyOf(stds);
        p95s  = List.copyOf(p95s);
    }

    public int windowCount() {
        return means.size();
    }
}
