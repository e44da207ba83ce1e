package com.valkyrlabs.gruff.acl;

import java.util.Objects;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.valkyrlabs.model.AclEntry;
import com.valkyrlabs.model.AclPermission;
import com.valkyrlabs.model.PrincipalType;

/**
 * A (principal, permission) pair as supplied by callers and as hashed into an
 * ACL's canonical form. Serializes as
 * {@code {"principal_type":"user","principal_id":"...","permission":"write"}}.
 */
@JsonPropertyOrder({ "principal_type", "principal_id", "permission" })
public final class AclGrant {

    private final PrincipalType principalType;
    private final UUID principalId;
    private final AclPermission permission;

    @JsonCreator
    public AclGrant(@JsonProperty("principal_type") PrincipalType principalType,
            @JsonProperty("principal_id") UUID principalId,
            @JsonProperty("permission") AclPermission permission) {
        this.principalType = Objects.requireNonNull(principalType, "principalType");
        this.principalId = Objects.requireNonNull(principalId, "principalId");
        this.permission = Objects.requireNonNull(permission, "permission");
    }

    public static AclGrant user(UUID userId, AclPermission permission) {
        return new AclGrant(PrincipalType.USER, userId, permission);
    }

    public static AclGrant group(UUID groupId, AclPermission permission) {
        return new AclGrant(PrincipalType.GROUP, groupId, permission);
    }

    public static AclGrant of(AclEntry entry) {
        return new AclGrant(entry.getPrincipalType(), entry.getPrincipalId(), entry.getPermission());
    }

    @JsonProperty("principal_type")
    public PrincipalType getPrincipalType() {
        return principalType;
    }

    @JsonProperty("principal_id")
    public UUID getPrincipalId() {
        return principalId;
    }

    @JsonProperty("permission")
    public AclPermission getPermission() {
        return permission;
    }

    boolean samePrincipal(AclGrant other) {
        return principalType == other.principalType && principalId.equals(other.principalId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AclGrant other)) {
            return false;
        }
        return principalType == other.principalType && principalId.equals(other.principalId)
                && permission == other.permission;
    }

    @Override
    public int hashCode() {
        return Objects.hash(principalType, principalId, permission);
    }

    @Override
    public String toString() {
        return principalType + ":" + principalId + ":" + permission;
    }
}
