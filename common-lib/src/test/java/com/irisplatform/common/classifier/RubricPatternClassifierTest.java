package com.irisplatform.common.classifier;

import com.irisplatform.common.exception.InvalidInputException;
import com.irisplatform.common.feature.FeatureExtractor;
import com.irisplatform.common.model.ClassificationLabel;
import com.irisplatform.common.model.ClassificationResult;
import com.irisplatform.common.model.ConfidenceTier;
import com.irisplatform.common.model.FeatureSet;
import com.irisplatform.common.model.PatternScore;
import com.irisplatform.common.model.PatternType;
import com.irisplatform.common.model.WindowStats;
import com.irisplatform.common.resolver.PatternResolver;
import com.irisplatform.common.scoring.PatternScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scenarios through extract → score → resolve using fixed window
 * fixtures.
 */
class RubricPatternClassifierTest {

    private final PatternClassifier classifier = new RubricPatternClassifier();

    static List<WindowStats> windows(double[] means, double[] stds, double[] p95s) {
        List<WindowStats> list = new ArrayList<>();
        for (int i = 0; i < means.length; i++) {
            list.add(WindowStats.of(means[i], stds[i], p95s[i]));
        }
        return list;
    }

    /** Mean +3 ms per window, stable std, p95 climbing by less than 5 ms overall. */
    static final List<WindowStats> DRIFT = windows(
        new double[]{30, 33, 36, 39},
        new double[]{1.1, 1.1, 1.1, 1.1},
        new double[]{45.0, 46.2, 47.5, 48.9});

    /** Flat jittery mean, std doubling every window, jumpy tail. */
    static final List<WindowStats> VARIANCE_EXPLOSION = windows(
        new double[]{40.0, 40.5, 39.8, 40.6},
        new double[]{1, 2, 4, 8},
        new double[]{43, 50, 46, 55});

    /** Flat jittery mean and std, p95 climbing steadily. */
    static final List<WindowStats> TAIL_ONLY = windows(
        new double[]{50.0, 50.6, 50.1, 50.5},
        new double[]{2.0, 2.1, 2.2, 2.1},
        new double[]{55, 58, 62, 66});

    /** Rising mean with moderate std growth and a noisy tail: drift and variance tie at 5. */
    static final List<WindowStats> AMBIGUOUS = windows(
        new double[]{40.0, 41.0, 42.0},
        new double[]{10.0, 11.5, 13.2},
        new double[]{60.0, 56.0, 59.5});

    /** Near-constant windows with small dips that break both trend flags. */
    static final List<WindowStats> FLAT = windows(
        new double[]{40.0, 39.6, 40.0},
        new double[]{2.0, 2.0, 2.0},
        new double[]{50.0, 49.4, 50.0});

    // ── scenarios ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("classify() — scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("A: drift → SLOW_DRIFT, HIGH")
        void drift() {
            PatternAnalysis analysis = classifier.analyze(DRIFT);

            assertTrue(analysis.features().meanTrendUp());
            assertTrue(analysis.features().p95TrendUp());
            assertEquals(1.0, analysis.features().stdGrowth(), 1e-9);
            assertEquals(9, analysis.scores().get(PatternType.SLOW_DRIFT));
            assertEquals(ClassificationLabel.SLOW_DRIFT, analysis.result().label());
            assertEquals(ConfidenceTier.HIGH, analysis.result().confidence());
            int gap = analysis.result().ranking().get(0).score() - analysis.result().ranking().get(1).score();
            assertTrue(gap >= 3, "gap was " + gap);
        }

        @Test
        @DisplayName("B: variance explosion → VARIANCE_EXPLOSION, HIGH")
        void varianceExplosion() {
            PatternAnalysis analysis = classifier.analyze(VARIANCE_EXPLOSION);

            assertEquals(8.0, analysis.features().stdGrowth(), 1e-9);
            assertFalse(analysis.features().meanTrendUp());
            assertTrue(analysis.features().meanDelta() < 3.5);
            assertTrue(analysis.scores().get(PatternType.VARIANCE_EXPLOSION) >= 9);
            assertEquals(ClassificationLabel.VARIANCE_EXPLOSION, analysis.result().label());
            assertEquals(ConfidenceTier.HIGH, analysis.result().confidence());
        }

        @Test
        @DisplayName("C: tail-only → TAIL_ONLY_DEGRADATION, HIGH")
        void tailOnly() {
            PatternAnalysis analysis = classifier.analyze(TAIL_ONLY);

            assertTrue(analysis.features().p95Delta() >= 5);
            assertTrue(analysis.features().p95TrendUp());
            assertTrue(analysis.scores().get(PatternType.TAIL_ONLY_DEGRADATION) >= 9);
            assertEquals(ClassificationLabel.TAIL_ONLY_DEGRADATION, analysis.result().label());
            assertEquals(ConfidenceTier.HIGH, analysis.result().confidence());
        }

        @Test
        @DisplayName("D: drift and variance both score 5 → MIXED_TRANSITION, LOW")
        void ambiguous() {
            PatternAnalysis analysis = classifier.analyze(AMBIGUOUS);

            assertEquals(5, analysis.scores().get(PatternType.SLOW_DRIFT));
            assertEquals(5, analysis.scores().get(PatternType.VARIANCE_EXPLOSION));
            assertEquals(ClassificationLabel.MIXED_TRANSITION, analysis.result().label());
            assertEquals(ConfidenceTier.LOW, analysis.result().confidence());
            assertEquals(PatternType.SLOW_DRIFT, analysis.result().top().pattern(),
                "tie resolved by priority order");
        }

        @Test
        @DisplayName("E: flat, no trend → UNCERTAIN, LOW")
        void flat() {
            PatternAnalysis analysis = classifier.analyze(FLAT);

            assertFalse(analysis.features().meanTrendUp());
            assertFalse(analysis.features().p95TrendUp());
            for (PatternType pattern : PatternType.values()) {
                assertTrue(analysis.scores().get(pattern) <= 4, pattern + " scored " + analysis.scores().get(pattern));
            }
            assertEquals(ClassificationLabel.UNCERTAIN, analysis.result().label());
            assertEquals(ConfidenceTier.LOW, analysis.result().confidence());
        }
    }

    // ── rubric characteristics ────────────────────────────────────────────

    @Nested
    @DisplayName("rubric characteristics")
    class CharacteristicTests {

        @Test
        @DisplayName("drift with a p95 rise ≥ 5 ms lets the tail rubric close in → MEDIUM")
        void driftWithLargeTailShift() {
            ClassificationResult result = classifier.classify(windows(
                new double[]{30, 33, 36, 39},
                new double[]{1.1, 1.1, 1.1, 1.1},
                new double[]{35, 38, 41, 44}));

            assertEquals(ClassificationLabel.SLOW_DRIFT, result.label());
            assertEquals(ConfidenceTier.MEDIUM, result.confidence());
            assertEquals(PatternType.TAIL_ONLY_DEGRADATION, result.ranking().get(1).pattern());
        }

        @Test
        @DisplayName("perfectly constant windows count as non-decreasing → SLOW_DRIFT, MEDIUM")
        void constantWindows() {
            ClassificationResult result = classifier.classify(windows(
                new double[]{40, 40, 40},
                new double[]{2, 2, 2},
                new double[]{50, 50, 50}));

            assertEquals(ClassificationLabel.SLOW_DRIFT, result.label());
            assertEquals(ConfidenceTier.MEDIUM, result.confidence());
        }
    }

    // ── pipeline properties ───────────────────────────────────────────────

    @Nested
    @DisplayName("pipeline properties")
    class PipelineTests {

        @Test
        @DisplayName("score → resolve twice on identical input → equal results")
        void deterministic() {
            FeatureSet features = FeatureExtractor.extract(AMBIGUOUS);
            PatternScore firstScores = PatternScorer.score(features);
            PatternScore secondScores = PatternScorer.score(features);

            assertEquals(firstScores, secondScores);
            assertEquals(PatternResolver.resolve(firstScores), PatternResolver.resolve(secondScores));
            assertEquals(PatternResolver.resolve(firstScores).toString(),
                PatternResolver.resolve(secondScores).toString());
        }

        @Test
        @DisplayName("classify() equals analyze().result()")
        void classifyMatchesAnalyze() {
            assertEquals(classifier.analyze(TAIL_ONLY).result(), classifier.classify(TAIL_ONLY));
        }

        @Test
        @DisplayName("evidence lists the fired checks of the winner")
        void evidence() {
            PatternAnalysis analysis = classifier.analyze(DRIFT);
            assertEquals(List.of("mean_trend_up", "p95_trend_up", "mean_delta >= 3", "std_growth < 1.35"),
                analysis.evidence().get(PatternType.SLOW_DRIFT));
        }

        @Test
        @DisplayName("fewer than two windows → InvalidInputException")
        void tooFewWindows() {
            assertThrows(InvalidInputException.class,
                () -> classifier.classify(List.of(WindowStats.of(30, 1, 35))));
        }

        @Test
        @DisplayName("ranking always lists all patterns")
        void fullRanking() {
            assertEquals(PatternType.values().length, classifier.classify(FLAT).ranking().size());
        }
    }
}
