package com.irisplatform.common.scoring;

import com.irisplatform.common.model.PatternType;

import java.util.List;

import static com.irisplatform.common.scoring.RubricCheck.check;
import static com.irisplatform.common.scoring.TieredRubricRule.firstOf;

/**
 * The fixed, versioned rubric table. Bump {@link #RUBRIC_VERSION} whenever a row,
 * a threshold or a point value changes, since scores are only comparable under the
 * same rubric.
 *
 * <pre>
 *   SLOW_DRIFT             mean_trend_up +3 | p95_trend_up +2 | mean_delta &gt;= 3 +2
 *                          std_growth &lt; 1.35 +2, else std_growth &lt; 1.5 +1
 *   VARIANCE_EXPLOSION     std_growth &gt;= 1.5 +4, else std_growth &gt;= 1.3 +2
 *                          p95_delta &gt;= 3 +2 | not mean_trend_up +2 | mean_delta &lt; 3.5 +1
 *   TAIL_ONLY_DEGRADATION  p95_delta &gt;= 5 +4, else p95_delta &gt;= 3 +2
 *                          mean_delta &lt; 3 +2 | std_delta &lt; 3 +2 | p95_trend_up +1
 * </pre>
 *
 * <p>A new pattern is a new {@link PatternType} constant plus one more entry here;
 * existing rows and the resolver stay untouched.
 */
public final class PatternRubrics {

    public static final String RUBRIC_VERSION = "1";

    public static final PatternRubric SLOW_DRIFT = PatternRubric.of(PatternType.SLOW_DRIFT,
        check("mean_trend_up", 3, f -> f.meanTrendUp()),
        check("p95_trend_up", 2, f -> f.p95TrendUp()),
        check("mean_delta >= 3", 2, f -> f.meanDelta() >= 3.0),
        firstOf(
            check("std_growth < 1.35", 2, f -> f.stdGrowth() < 1.35),
            check("std_growth < 1.5", 1, f -> f.stdGrowth() < 1.5))
    );

    public static final PatternRubric VARIANCE_EXPLOSION = PatternRubric.of(PatternType.VARIANCE_EXPLOSION,
        firstOf(
            check("std_growth >= 1.5", 4, f -> f.stdGrowth() >= 1.5),
            check("std_growth >= 1.3", 2, f -> f.stdGrowth() >= 1.3)),
        check("p95_delta >= 3", 2, f -> f.p95Delta() >= 3.0),
        check("not mean_trend_up", 2, f -> !f.meanTrendUp()),
        check("mean_delta < 3.5", 1, f -> f.meanDelta() < 3.5)
    );

    public static final PatternRubric TAIL_ONLY_DEGRADATION = PatternRubric.of(PatternType.TAIL_ONLY_DEGRADATION,
        firstOf(
            check("p95_delta >= 5", 4, f -> f.p95Delta() >= 5.0),
            check("p95_delta >= 3", 2, f -> f.p95Delta() >= 3.0)),
        check("mean_delta < 3", 2, f -> f.meanDelta() < 3.0),
        check("std_delta < 3", 2, f -> f.stdDelta() < 3.0),
        check("p95_trend_up", 1, f -> f.p95TrendUp())
    );

    /** One rubric per {@link PatternType}, in priority order. */
    public static final List<PatternRubric> DEFAULT = List.of(
        SLOW_DRIFT,
        VARIANCE_EXPLOSION,
        TAIL_ONLY_DEGRADATION
    );

    private PatternRubrics() {}
}
