package com.valkyrlabs.gruff.error;

/**
 * The operation would break an invariant: duplicate names, membership cycles,
 * nesting depth, or a version transition that is not allowed from the current state.
 */
public class ConflictException extends GruffException {

    private static final long serialVersionUID = 1928374650192837L;

    public ConflictException(String code, String message) {
        super(code, message);
    }
}
