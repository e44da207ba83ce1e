package com.valkyrlabs.gruff.acl;

import java.util.List;

/**
 * Result of {@link CanonicalAclStore#validatePrincipals}: one message per unknown
 * principal.
 */
public class PrincipalValidation {

    private final List<String> errors;

    public PrincipalValidation(List<String> errors) {
        this.errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }
}
