package com.irisplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.irisplatform.common.classifier.PatternAnalysis;
import com.irisplatform.common.model.ClassificationLabel;
import com.irisplatform.common.model.ConfidenceTier;
import com.irisplatform.common.model.FeatureSet;
import com.irisplatform.common.model.PatternType;
import com.irisplatform.common.model.RankedPattern;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Classification outcome returned to API callers, including the features and fired
 * rubric checks behind the label.
 */
public record ClassificationResponseDTO(
    @JsonProperty("source")         String source,
    @JsonProperty("label")          ClassificationLabel label,
    @JsonProperty("confidence")     ConfidenceTier confidence,
    @JsonProperty("interpretation") String interpretation,
    @JsonProperty("ranking")        List<RankedPattern> ranking,
    @JsonProperty("features")       FeatureSet features,
    @JsonProperty("evidence")       Map<PatternType, List<String>> evidence,
    @JsonProperty("rubricVersion")  String rubricVersion,
    @JsonProperty("traceId")        String traceId,
    @JsonProperty("classifiedAt")   Instant classifiedAt
) {
    public static ClassificationResponseDTO from(String source, PatternAnalysis analysis,
                                                 String rubricVersion, String traceId,
                                                 Instant classifiedAt) {
        return new ClassificationResponseDTO(
            source,
            analysis.result().label(),
            analysis.result().confidence(),
            analysis.result().label().interpretation(),
            analysis.result().ranking(),
            analysis.features(),
            analysis.evidence(),
            rubricVersion,
            traceId,
            classifiedAt
        );
    }
}
