package com.irisplatform.common.scoring;

import com.irisplatform.common.model.FeatureSet;

import java.util.List;

/**
 * One row group of a pattern rubric.
 *
 * <p>Implementations must be stateless and pure. Two shapes exist:
 * <ul>
 *   <li>{@link RubricCheck} — an independent check that awards its points whenever
 *       its predicate holds</li>
 *   <li>{@link TieredRubricRule} — mutually exclusive tiers, only the first satisfied
 *       tier awards points</li>
 * </ul>
 */
public interface RubricRule {

    /**
     * @param features features of the current run
     * @return the checks that award points for {@code features}, in rubric order;
     *         empty when nothing fires, never null
     */
    List<RubricCheck> fired(FeatureSet features);

    /** Every check this rule can award, in rubric order. */
    List<RubricCheck> checks();

    default int points(FeatureSet features) {
        return fired(features).stream().mapToInt(RubricCheck::points).sum();
    }
}
