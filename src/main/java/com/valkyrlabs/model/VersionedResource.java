package com.valkyrlabs.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;

/**
 * One immutable row of a resource's version chain.
 *
 * <p>
 * Every create, update, delete, restore or ACL change appends a row whose
 * {@code previousVersionId} points at the row it supersedes. Exactly one row per
 * chain carries {@code latest = true}; the chain's first row has no predecessor and
 * {@code version = 1}.
 * </p>
 *
 * @author johnmcmahon
 */
@MappedSuperclass
public abstract class VersionedResource implements AclScoped {

    @Id
    private UUID id;

    @Column(name = "version", nullable = false)
    private int version;

    @Column(name = "previous_version_id")
    private UUID previousVersionId;

    @Column(name = "is_latest", nullable = false)
    private boolean latest;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "acl_id")
    private Long aclId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "created_by")
    private UUID createdBy;

    @Convert(converter = JsonPropertiesConverter.class)
    @Column(name = "properties", length = 65535)
    private Map<String, Object> properties = new LinkedHashMap<>();

    public abstract ResourceKind getKind();

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public UUID getPreviousVersionId() {
        return previousVersionId;
    }

    public void setPreviousVersionId(UUID previousVersionId) {
        this.previousVersionId = previousVersionId;
    }

    public boolean isLatest() {
        return latest;
    }

    public void setLatest(boolean latest) {
        this.latest = latest;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }

    @Override
    public Long getAclId() {
        return aclId;
    }

    public void setAclId(Long aclId) {
        this.aclId = aclId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(UUID createdBy) {
        this.createdBy = createdBy;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public void setProperties(Map<String, Object> properties) {
        this.properties = properties == null ? new LinkedHashMap<>() : new LinkedHashMap<>(properties);
    }

    @Override
    public String toString() {
        return getKind().getValue() + "[" + id + " v" + version + (latest ? " latest" : "")
                + (deleted ? " deleted" : "") + "]";
    }
}
