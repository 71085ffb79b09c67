package com.irisplatform.common.model;

/**
 * Qualitative strength of a classification, derived from the winning score and its
 * separation from the runner-up.
 */
public enum ConfidenceTier {
    HIGH,
    MEDIUM,
    LOW
}
