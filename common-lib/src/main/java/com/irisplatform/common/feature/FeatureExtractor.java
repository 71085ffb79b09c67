package com.irisplatform.common.feature;

import com.irisplatform.common.exception.InvalidInputException;
import com.irisplatform.common.model.FeatureSet;
import com.irisplatform.common.model.WindowStats;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure stateless reduction of an ordered {@link WindowStats} sequence into the
 * scalar trend and stability features the rubric scores against.
 *
 * <h3>Features</h3>
 * <ul>
 *   <li><b>Deltas</b> — {@code max(seq) - min(seq)} per metric over the whole run,
 *       so a single noisy window cannot hide behind matching endpoints.</li>
 *   <li><b>Trend flags</b> — "almost monotonic" test: every step may drop by at most
 *       the slack ({@value #MEAN_SLACK} for means, {@value #P95_SLACK} for p95).</li>
 *   <li><b>Std growth</b> — {@code stds[last] / stds[0]}, with {@value #EPSILON}
 *       substituted for a zero first-window std, capped at {@code Double.MAX_VALUE}.</li>
 * </ul>
 *
 * <p>Window order encodes time and is never re-sorted. No logging. No side-effects.
 */
public final class FeatureExtractor {

    /** Minimum number of windows: at least one inter-window delta is needed. */
    public static final int MIN_WINDOWS = 2;

    /** Per-step drop tolerated in the mean trend. */
    public static final double MEAN_SLACK = 0.3;

    /** Per-step drop tolerated in the p95 trend. */
    public static final double P95_SLACK = 0.5;

    /** Floor for a zero first-window std in the growth ratio. */
    public static final double EPSILON = 1e-9;

    private static final String STAGE = "FeatureExtractor";

    private FeatureExtractor() {}

    /**
     * Derives the {@link FeatureSet} for one run.
     *
     * @param windows ordered window statistics, oldest first
     * @return immutable features; never null
     * @throws InvalidInputException when {@code windows} is null, shorter than
     *         {@value #MIN_WINDOWS}, or contains a null element
     */
    public static FeatureSet extract(List<WindowStats> windows) {
        if (windows == null || windows.size() < MIN_WINDOWS) {
            throw InvalidInputException.insufficientData(STAGE, "windows", MIN_WINDOWS,
                windows == null ? 0 : windows.size());
        }

        List<Double> means = new ArrayList<>(windows.size());
        List<Double> stds  = new ArrayList<>(windows.size());
        List<Double> p95s  = new ArrayList<>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            WindowStats w = windows.get(i);
            if (w == null) {
                throw InvalidInputException.invalidValue(STAGE, "window[" + i + "]", null, "non-null WindowStats");
            }
            means.add(w.mean());
            stds.add(w.std());
            p95s.add(w.p95());
        }

        return new FeatureSet(
            means, stds, p95s,
            delta(means),
            delta(stds),
            delta(p95s),
            isMonotonicIncreasing(means, MEAN_SLACK),
            isMonotonicIncreasing(p95s, P95_SLACK),
            stdGrowth(stds)
        );
    }

    // ── feature primitives ─────────────────────────────────────────────────

    /**
     * Returns true iff {@code seq[i] <= seq[i+1] + slack} for every adjacent pair.
     * Equal neighbours count as non-decreasing; empty and single-element sequences
     * are trivially monotonic.
     */
    public static boolean isMonotonicIncreasing(List<Double> seq, double slack) {
        for (int i = 0; i + 1 < seq.size(); i++) {
            if (seq.get(i) > seq.get(i + 1) + slack) {
                return false;
            }
        }
        return true;
    }

    /** {@code max(seq) - min(seq)}; 0.0 for an empty sequence. */
    public static double delta(List<Double> seq) {
        double max = seq.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double min = seq.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        return max - min;
    }

    /**
     * How many times variability multiplied between the first and last window.
     * Saturates at {@link Double#MAX_VALUE} so the ratio stays finite.
     */
    public static double stdGrowth(List<Double> stds) {
        double first = stds.get(0);
        double last  = stds.get(stds.size() - 1);
        return Math.min(last / (first != 0.0 ? first : EPSILON), Double.MAX_VALUE);
    }
}
