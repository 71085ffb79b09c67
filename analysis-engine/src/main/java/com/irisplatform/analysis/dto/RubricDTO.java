package com.irisplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.irisplatform.common.model.PatternType;
import com.irisplatform.common.scoring.PatternRubric;
import com.irisplatform.common.scoring.RubricCheck;
import com.irisplatform.common.scoring.TieredRubricRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of the rubric table the engine scores against.
 */
public record RubricDTO(
    @JsonProperty("rubricVersion") String rubricVersion,
    @JsonProperty("patterns")      List<PatternRubricDTO> patterns
) {

    public record PatternRubricDTO(
        @JsonProperty("pattern")  PatternType pattern,
        @JsonProperty("priority") int priority,
        @JsonProperty("maxScore") int maxScore,
        @JsonProperty("checks")   List<CheckDTO> checks
    ) {}

    /** {@code tierGroup} is the 1-based tier group index, 0 for independent checks. */
    public record CheckDTO(
        @JsonProperty("name")      String name,
        @JsonProperty("points")    int points,
        @JsonProperty("tierGroup") int tierGroup
    ) {}

    public static RubricDTO from(String rubricVersion, List<PatternRubric> rubrics) {
        List<PatternRubricDTO> patterns = new ArrayList<>();
        for (int i = 0; i < rubrics.size(); i++) {
            PatternRubric rubric = rubrics.get(i);
            List<CheckDTO> checks = new ArrayList<>();
            int tierGroup = 0;
            for (var rule : rubric.rules()) {
                int group = rule instanceof TieredRubricRule ? ++tierGroup : 0;
                for (RubricCheck check : rule.checks()) {
                    checks.add(new CheckDTO(check.name(), check.points(), group));
                }
            }
            patterns.add(new PatternRubricDTO(rubric.pattern(), i + 1, rubric.maxScore(), checks));
        }
        return new RubricDTO(rubricVersion, patterns);
    }
}
