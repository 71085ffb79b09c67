package com.irisplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.irisplatform.common.model.WindowStats;

import java.util.List;

/**
 * Pre-aggregated windows to classify, oldest first.
 * {@code source} and {@code traceId} are optional.
 */
public record ClassificationRequest(
    @JsonProperty("source")  String source,
    @JsonProperty("windows") List<WindowStats> windows,
    @JsonProperty("traceId") String traceId
) {}
