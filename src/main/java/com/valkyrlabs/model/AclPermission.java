package com.valkyrlabs.model;

import java.util.EnumSet;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two permissions a resource ACL can grant.
 *
 * <p>
 * WRITE implies READ: an entry granting WRITE also satisfies a READ check, and a
 * READ entry next to a WRITE entry for the same principal is redundant.
 * </p>
 */
public enum AclPermission {

    READ("read"),
    WRITE("write");

    private final String value;

    AclPermission(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Permissions whose presence in an ACL entry satisfies a check for this one.
     */
    public Set<AclPermission> grantedBy() {
        if (this == READ) {
            return EnumSet.of(READ, WRITE);
        }
        return EnumSet.of(WRITE);
    }

    /** Whether holding this permission also grants {@code other}. */
    public boolean implies(AclPermission other) {
        return other != null && other.grantedBy().contains(this);
    }

    /**
     * Lenient mapping used at the Spring Security boundary, where permissions
     * arrive as strings ("READ", "write", "update").
     *
     * @return the permission, or {@code null} if the string is not recognised
     */
    public static AclPermission fromString(String permission) {
        if (permission == null) {
            return null;
        }
        String s = permission.trim().toUpperCase();
        if ("READ".equals(s) || "LIST".equals(s) || "VIEW".equals(s)) {
            return READ;
        }
        if ("WRITE".equals(s) || "UPDATE".equals(s) || "DELETE".equals(s) || "RESTORE".equals(s)) {
            return WRITE;
        }
        return null;
    }

    @JsonCreator
    public static AclPermission fromValue(String value) {
        AclPermission p = fromString(value);
        if (p == null) {
            throw new IllegalArgumentException("Unknown permission: " + value);
        }
        return p;
    }

    @Override
    public String toString() {
        return value;
    }
}
