package com.valkyrlabs.model;

import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * One (principal, permission) grant inside an {@link Acl}.
 */
@Entity
@Table(name = "acl_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_acl_entries_grant",
                columnNames = { "acl_id", "principal_type", "principal_id", "permission" }),
        indexes = @Index(name = "idx_acl_entries_principal", columnList = "principal_type, principal_id"))
public class AclEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "acl_id", nullable = false)
    private Long aclId;

    @Convert(converter = PrincipalTypeConverter.class)
    @Column(name = "principal_type", nullable = false, length = 16)
    private PrincipalType principalType;

    @Column(name = "principal_id", nullable = false)
    private UUID principalId;

    @Convert(converter = AclPermissionConverter.class)
    @Column(name = "permission", nullable = false, length = 16)
    private AclPermission permission;

    protected AclEntry() {
    }

    public AclEntry(Long aclId, PrincipalType principalType, UUID principalId, AclPermission permission) {
        this.aclId = aclId;
        this.principalType = principalType;
        this.principalId = principalId;
        this.permission = permission;
    }

    public Long getId() {
        return id;
    }

    public Long getAclId() {
        return aclId;
    }

    public PrincipalType getPrincipalType() {
        return principalType;
    }

    public UUID getPrincipalId() {
        return principalId;
    }

    public AclPermission getPermission() {
        return permission;
    }
}
