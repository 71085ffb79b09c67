package com.irisplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RankedPattern(
    @JsonProperty("pattern") PatternType pattern,
    @JsonProperty("score")   int score
) {}
