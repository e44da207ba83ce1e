package com.valkyrlabs.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of principal an ACL entry or group membership refers to.
 */
public enum PrincipalType {

    USER("user"),
    GROUP("group");

    private final String value;

    PrincipalType(String value) {
        this.value = value;
    }

    /** Stored and serialized form, e.g. {@code "user"}. */
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PrincipalType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Principal type must not be null");
        }
        String s = value.trim().toLowerCase();
        for (PrincipalType type : values()) {
            if (type.value.equals(s)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown principal type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
