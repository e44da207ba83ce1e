package com.valkyrlabs.gruff.error;

/**
 * Base of the caller-visible failures raised by {@link Outcome#orElseThrow()}.
 */
public class GruffException extends RuntimeException {

    private static final long serialVersionUID = 4471023847120394L;

    private final String code;

    public GruffException(String code, String message) {
        super(message);
        this.code = code;
    }

    /** Stable machine-readable code, e.g. {@code CIRCULAR_MEMBERSHIP}. */
    public String getCode() {
        return code;
    }
}
