package com.valkyrlabs.gruff.error;

import java.util.Collections;
import java.util.List;

public class InvalidAclException extends GruffException {

    private static final long serialVersionUID = 5582910347781L;

    private final List<String> errors;

    public InvalidAclException(String message, List<String> errors) {
        super(Outcome.CODE_INVALID_ACL, message);
        this.errors = errors == null ? Collections.emptyList() : List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
