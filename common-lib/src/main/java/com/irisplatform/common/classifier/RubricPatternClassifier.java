package com.irisplatform.common.classifier;

import com.irisplatform.common.feature.FeatureExtractor;
import com.irisplatform.common.model.ClassificationResult;
import com.irisplatform.common.model.FeatureSet;
import com.irisplatform.common.model.PatternScore;
import com.irisplatform.common.model.WindowStats;
import com.irisplatform.common.resolver.PatternResolver;
import com.irisplatform.common.scoring.PatternRubric;
import com.irisplatform.common.scoring.PatternRubrics;
import com.irisplatform.common.scoring.PatternScorer;

import java.util.List;

/**
 * Default {@link PatternClassifier}: {@link FeatureExtractor#extract} →
 * {@link PatternScorer#score} → {@link PatternResolver#resolve}.
 *
 * <p>Holds only the immutable rubric table it scores against. Stateless and
 * thread-safe.
 */
public class RubricPatternClassifier implements PatternClassifier {

    private final List<PatternRubric> rubrics;

    public RubricPatternClassifier() {
        this(PatternRubrics.DEFAULT);
    }

    RubricPatternClassifier(List<PatternRubric> rubrics) {
        this.rubrics = List.copyOf(rubrics);
    }

    @Override
    public PatternAnalysis analyze(List<WindowStats> windows) {
        FeatureSet features = FeatureExtractor.extract(windows);
        PatternScore scores = PatternScorer.score(features, rubrics);
        ClassificationResult result = PatternResolver.resolve(scores);
        return new PatternAnalysis(features, scores, PatternScorer.explain(features, rubrics), result);
    }

    public List<PatternRubric> rubrics() {
        return rubrics;
    }
}
