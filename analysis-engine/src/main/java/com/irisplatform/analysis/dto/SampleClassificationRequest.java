package com.irisplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw latency samples grouped per window, oldest window first. Each inner list is
 * reduced to {@link com.irisplatform.common.model.WindowStats} before classification.
 */
public record SampleClassificationRequest(
    @JsonProperty("source")  String source,
    @JsonProperty("windows") List<List<Double>> windows,
    @JsonProperty("traceId") String traceId
) {}
