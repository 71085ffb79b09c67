package com.irisplatform.common.scoring;

import com.irisplatform.common.model.FeatureSet;
import com.irisplatform.common.model.PatternScore;
import com.irisplatform.common.model.PatternType;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a {@link FeatureSet} through the rubric table into one integer score per
 * pattern.
 *
 * <p>Pure function of its arguments: deterministic, no logging, safe to call
 * concurrently. The single-argument overloads use {@link PatternRubrics#DEFAULT}.
 */
public final class PatternScorer {

    private PatternScorer() {}

    public static PatternScore score(FeatureSet features) {
        return score(features, PatternRubrics.DEFAULT);
    }

    /**
     * @param features features of the current run
     * @param rubrics  one rubric per pattern
     * @return score per pattern covered by {@code rubrics}
     */
    public static PatternScore score(FeatureSet features, List<PatternRubric> rubrics) {
        Map<PatternType, Integer> scores = new EnumMap<>(PatternType.class);
        for (PatternRubric rubric : rubrics) {
            scores.put(rubric.pattern(), rubric.score(features));
        }
        return PatternScore.of(scores);
    }

    public static Map<PatternType, List<String>> explain(FeatureSet features) {
        return explain(features, PatternRubrics.DEFAULT);
    }

    /**
     * Names of the checks that awarded points, per pattern in rubric order. The points
     * of the listed checks add up to the pattern's score.
     */
    public static Map<PatternType, List<String>> explain(FeatureSet features, List<PatternRubric> rubrics) {
        Map<PatternType, List<String>> evidence = new LinkedHashMap<>();
        for (PatternRubric rubric : rubrics) {
            evidence.put(rubric.pattern(), rubric.fired(features).stream()
                .map(RubricCheck::name)
                .toList());
        }
        return evidence;
    }
}
