package com.irisplatform.common.exception;

/**
 * Raised when a caller hands the classification pipeline input it cannot work with:
 * too few windows, negative or non-finite statistics, or a score map that does not
 * cover exactly the known pattern set.
 *
 * <p>Always a caller-input defect; the pipeline performs no I/O, so retrying the same
 * call cannot succeed. The message is prefixed with the rejecting stage, e.g.
 * {@code [FeatureExtractor] ...}.
 */
public class InvalidInputException extends RuntimeException {

    private final String stage;

    public InvalidInputException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }

    public static InvalidInputException insufficientData(String stage, String what,
                                                         int required, int actual) {
        return new InvalidInputException(stage,
            String.format("Insufficient %s: need at least %d, but got %d", what, required, actual));
    }

    public static InvalidInputException invalidValue(String stage, String field,
                                                     Object value, String expected) {
        return new InvalidInputException(stage,
            String.format("Invalid %s: got '%s', expected %s", field, value, expected));
    }
}
