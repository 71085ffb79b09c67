package com.irisplatform.common.scoring;

import com.irisplatform.common.model.FeatureSet;
import com.irisplatform.common.model.PatternType;

import java.util.List;
import java.util.Objects;

/**
 * Additive rubric of a single {@link PatternType}: the score is the sum of the
 * points of every rule that fires. Not normalized, not capped.
 */
public record PatternRubric(PatternType pattern, List<RubricRule> rules) {

    public PatternRubric {
        Objects.requireNonNull(pattern, "pattern");
        rules = List.copyOf(rules);
    }

    public static PatternRubric of(PatternType pattern, RubricRule... rules) {
        return new PatternRubric(pattern, List.of(rules));
    }

    public int score(FeatureSet features) {
        int total = 0;
        for (RubricRule rule : rules) {
            total += rule.points(features);
        }
        return total;
    }

    public List<RubricCheck> fired(FeatureSet features) {
        return rules.stream()
            .flatMap(rule -> rule.fired(features).stream())
            .toList();
    }

    /** Highest score this rubric can award (every independent check plus each top tier). */
    public int maxScore() {
        return rules.stream()
            .mapToInt(rule -> rule.checks().stream().mapToInt(RubricCheck::points).max().orElse(0))
            .sum();
    }
}
