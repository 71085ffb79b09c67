package com.irisplatform.common.classifier;

import com.irisplatform.common.model.ClassificationResult;
import com.irisplatform.common.model.WindowStats;

import java.util.List;

/**
 * Strategy contract for classifying the degradation shape of an ordered run of
 * latency windows.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b> — no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>      — no logging, no reactive types, no side effects</li>
 *   <li><b>Non-null</b>  — always return a result or throw
 *       {@link com.irisplatform.common.exception.InvalidInputException}</li>
 * </ul>
 *
 * <p>Current implementation: {@link RubricPatternClassifier}. Register as a Spring
 * {@code @Bean} in the host's configuration to swap implementations without changing
 * any downstream code.
 */
public interface PatternClassifier {

    /**
     * Runs the full pipeline and keeps every intermediate value.
     *
     * @param windows ordered window statistics, oldest first, at least two
     * @return features, scores, fired checks and the final result
     */
    PatternAnalysis analyze(List<WindowStats> windows);

    default ClassificationResult classify(List<WindowStats> windows) {
        return analyze(windows).result();
    }
}
