package com.irisplatform.common.scoring;

import com.irisplatform.common.model.FeatureSet;

import java.util.List;

/**
 * "if / else if" group of checks: tiers are evaluated top-down and only the first
 * satisfied tier awards its points. Tiers are listed highest first.
 */
public record TieredRubricRule(List<RubricCheck> tiers) implements RubricRule {

    public TieredRubricRule {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("A tiered rule needs at least one tier");
        }
        tiers = List.copyOf(tiers);
    }

    public static TieredRubricRule firstOf(RubricCheck... tiers) {
        return new TieredRubricRule(List.of(tiers));
    }

    @Override
    public List<RubricCheck> fired(FeatureSet features) {
        for (RubricCheck tier : tiers) {
            if (tier.test(features)) {
                return List.of(tier);
            }
        }
        return List.of();
    }

    @Override
    public List<RubricCheck> checks() {
        return tiers;
    }
}
