package com.irisplatform.common.classifier;

import com.irisplatform.common.model.ClassificationResult;
import com.irisplatform.common.model.FeatureSet;
import com.irisplatform.common.model.PatternScore;
import com.irisplatform.common.model.PatternType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one classification run produced, for callers that want to show why a
 * label was chosen and not only which.
 *
 * @param features extracted trend and stability features
 * @param scores   rubric score per pattern
 * @param evidence names of the checks that fired, per pattern
 * @param result   final label, confidence and ranking
 */
public record PatternAnalysis(
    FeatureSet features,
    PatternScore scores,
    Map<PatternType, List<String>> evidence,
    ClassificationResult result
) {
    public PatternAnalysis {
        evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }
}
