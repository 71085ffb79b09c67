package com.irisplatform.common.scoring;

import com.irisplatform.common.model.FeatureSet;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Named boolean or threshold check over a {@link FeatureSet} worth a fixed number
 * of points.
 *
 * @param name      rubric-facing description, e.g. {@code "std_growth >= 1.5"}
 * @param points    points awarded when {@code predicate} holds; never negative
 * @param predicate pure test over the features
 */
public record RubricCheck(String name, int points, Predicate<FeatureSet> predicate) implements RubricRule {

    public RubricCheck {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(predicate, "predicate");
        if (points < 0) {
            throw new IllegalArgumentException("Rubric points must be >= 0, got " + points + " for " + name);
        }
    }

    public static RubricCheck check(String name, int points, Predicate<FeatureSet> predicate) {
        return new RubricCheck(name, points, predicate);
    }

    public boolean test(FeatureSet features) {
        return predicate.test(features);
    }

    @Override
    public List<RubricCheck> fired(FeatureSet features) {
        return test(features) ? List.of(this) : List.of();
    }

    @Override
    public List<RubricCheck> checks() {
        return List.of(this);
    }
}
