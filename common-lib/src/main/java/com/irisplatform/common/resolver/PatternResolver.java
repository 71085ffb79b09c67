package com.irisplatform.common.resolver;

import com.irisplatform.common.exception.InvalidInputException;
import com.irisplatform.common.model.ClassificationLabel;
import com.irisplatform.common.model.ClassificationResult;
import com.irisplatform.common.model.ConfidenceTier;
import com.irisplatform.common.model.PatternScore;
import com.irisplatform.common.model.PatternType;
import com.irisplatform.common.model.RankedPattern;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Turns per-pattern scores into a single label with a confidence tier.
 *
 * <h3>Ranking</h3>
 * <p>Score descending; exact ties are broken by {@link #PRIORITY_ORDER}
 * ({@code SLOW_DRIFT > VARIANCE_EXPLOSION > TAIL_ONLY_DEGRADATION}), so the ranking
 * never depends on map iteration order.
 *
 * <h3>Decision rules</h3>
 * <p>With {@code gap = top.score - second.score}, evaluated top-to-bottom, first
 * match wins:
 * <pre>
 *   top &gt;= 8 AND gap &gt;= 3  → HIGH,   label = top pattern
 *   top &gt;= 6 AND gap &gt;= 2  → MEDIUM, label = top pattern
 *   top &gt;= 5 AND gap &lt;= 1  → LOW,    MIXED_TRANSITION
 *   otherwise             → LOW,    UNCERTAIN
 * </pre>
 *
 * <p>No pattern-specific logic lives here. No logging. No side-effects.
 */
public final class PatternResolver {

    /** Tie-break order, highest priority first. */
    public static final List<PatternType> PRIORITY_ORDER = List.of(PatternType.values());

    static final int HIGH_MIN_SCORE   = 8;
    static final int HIGH_MIN_GAP     = 3;
    static final int MEDIUM_MIN_SCORE = 6;
    static final int MEDIUM_MIN_GAP   = 2;
    static final int MIXED_MIN_SCORE  = 5;
    static final int MIXED_MAX_GAP    = 1;

    private static final String STAGE = "PatternResolver";

    private static final Comparator<RankedPattern> RANKING_ORDER =
        Comparator.comparingInt(RankedPattern::score).reversed()
            .thenComparingInt(r -> PRIORITY_ORDER.indexOf(r.pattern()));

    private PatternResolver() {}

    /**
     * @param scores one non-negative score for each known {@link PatternType}
     * @return label, confidence and full ranking; never null
     * @throws InvalidInputException when {@code scores} is null, misses a pattern,
     *         or holds a null or negative score
     */
    public static ClassificationResult resolve(PatternScore scores) {
        List<RankedPattern> ranking = rank(scores);

        RankedPattern top    = ranking.get(0);
        RankedPattern second = ranking.get(1);
        int gap = top.score() - second.score();

        if (top.score() >= HIGH_MIN_SCORE && gap >= HIGH_MIN_GAP) {
            return new ClassificationResult(ClassificationLabel.fromPattern(top.pattern()),
                ConfidenceTier.HIGH, ranking);
        }
        if (top.score() >= MEDIUM_MIN_SCORE && gap >= MEDIUM_MIN_GAP) {
            return new ClassificationResult(ClassificationLabel.fromPattern(top.pattern()),
                ConfidenceTier.MEDIUM, ranking);
        }
        if (top.score() >= MIXED_MIN_SCORE && gap <= MIXED_MAX_GAP) {
            return new ClassificationResult(ClassificationLabel.MIXED_TRANSITION, ConfidenceTier.LOW, ranking);
        }
        return new ClassificationResult(ClassificationLabel.UNCERTAIN, ConfidenceTier.LOW, ranking);
    }

    /**
     * Orders every pattern by score descending, ties by {@link #PRIORITY_ORDER}.
     */
    public static List<RankedPattern> rank(PatternScore scores) {
        validate(scores);
        List<RankedPattern> ranking = new ArrayList<>(PRIORITY_ORDER.size());
        for (PatternType pattern : PRIORITY_ORDER) {
            ranking.add(new RankedPattern(pattern, scores.get(pattern)));
        }
        ranking.sort(RANKING_ORDER);
        return List.copyOf(ranking);
    }

    private static void validate(PatternScore scores) {
        if (scores == null) {
            throw new InvalidInputException(STAGE, "Pattern scores must not be null");
        }
        Set<PatternType> present = scores.scores().isEmpty()
            ? EnumSet.noneOf(PatternType.class)
            : EnumSet.copyOf(scores.scores().keySet());
        if (!present.equals(EnumSet.copyOf(PRIORITY_ORDER))) {
            throw InvalidInputException.invalidValue(STAGE, "pattern set", present, PRIORITY_ORDER.toString());
        }
        for (PatternType pattern : PRIORITY_ORDER) {
            Integer score = scores.get(pattern);
            if (score == null || score < 0) {
                throw InvalidInputException.invalidValue(STAGE, "score of " + pattern, score,
                    "a non-negative integer");
            }
        }
    }
}
