package com.irisplatform.common.stats;

import com.irisplatform.common.exception.InvalidInputException;
import com.irisplatform.common.model.WindowStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reduces the raw latency samples of one window to {@link WindowStats}.
 *
 * <ul>
 *   <li>mean — arithmetic mean</li>
 *   <li>std  — sample standard deviation (n − 1); 0.0 below two samples</li>
 *   <li>p95  — linearly interpolated 95th percentile of the sorted samples</li>
 * </ul>
 *
 * <p>Sample order inside a window does not matter. No logging. No side-effects.
 */
public final class WindowStatsCalculator {

    public static final double TAIL_PERCENTILE = 95.0;

    private static final String STAGE = "WindowStatsCalculator";

    private WindowStatsCalculator() {}

    /**
     * @param samples latency samples of one window, at least one
     * @throws InvalidInputException on an empty window or a null, negative or
     *         non-finite sample
     */
    public static WindowStats compute(List<Double> samples) {
        if (samples == null || samples.isEmpty()) {
            throw InvalidInputException.insufficientData(STAGE, "samples", 1, 0);
        }
        for (int i = 0; i < samples.size(); i++) {
            Double s = samples.get(i);
            if (s == null || !Double.isFinite(s) || s < 0.0) {
                throw InvalidInputException.invalidValue(STAGE, "sample[" + i + "]", s, "a finite value >= 0");
            }
        }

        List<Double> sorted = new ArrayList<>(samples);
        Collections.sort(sorted);

        return new WindowStats(mean(samples), sampleStdDev(samples), percentile(sorted, TAIL_PERCENTILE));
    }

    /** Convenience for callers holding several windows of raw samples. */
    public static List<WindowStats> computeAll(List<List<Double>> windows) {
        if (windows == null) {
            throw InvalidInputException.insufficientData(STAGE, "windows", 1, 0);
        }
        return windows.stream().map(WindowStatsCalculator::compute).toList();
    }

    public static double mean(List<Double> samples) {
        return samples.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public static double sampleStdDev(List<Double> samples) {
        int n = samples.size();
        if (n < 2) return 0.0;
        double mean = mean(samples);
        double sumSq = 0.0;
        for (double s : samples) {
            double diff = s - mean;
            sumSq += diff * diff;
        }
        return Math.sqrt(sumSq / (n - 1));
    }

    /**
     * Linear-interpolation percentile:
     * <pre>
     *   k = (n - 1) * p / 100,  f = floor(k),  c = min(f + 1, n - 1)
     *   f == c → sorted[f]
     *   else   → sorted[f] + (sorted[c] - sorted[f]) * (k - f)
     * </pre>
     *
     * @param sortedValues ascending, non-empty
     * @param p            percentile in [0, 100]
     */
    public static double percentile(List<Double> sortedValues, double p) {
        if (sortedValues == null || sortedValues.isEmpty()) {
            throw InvalidInputException.insufficientData(STAGE, "values", 1, 0);
        }
        if (!(p >= 0.0 && p <= 100.0)) {
            throw InvalidInputException.invalidValue(STAGE, "percentile", p, "a value in [0, 100]");
        }
        int n = sortedValues.size();
        double k = (n - 1) * (p / 100.0);
        int f = (int) k;
        int c = Math.min(f + 1, n - 1);
        if (f == c) {
            return sortedValues.get(f);
        }
        double lower = sortedValues.get(f);
        double upper = sortedValues.get(c);
        return lower + (upper - lower) * (k - f);
    }
}
