package com.flightsentinel.core.detection;

/**
 * Thrown when a telemetry record lacks one of the fields required to build a
 * feature vector, or carries a non-numeric value for it.
 *
 * @since 1.0.0
 */
public class MissingFieldException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public MissingFieldException(String field) {
        super("Required telemetry field missing or not numeric: '" + field + "'");
        this.field = field;
    }

    /**
     * @return name of the offending field
     */
    public String getField() {
        return field;
    }
}
