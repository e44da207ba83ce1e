package com.valkyrlabs.model;

import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * A directed edge between two entities.
 */
@Entity
@Table(name = "links", indexes = {
        @Index(name = "idx_links_source_latest_deleted", columnList = "source_entity_id, is_latest, is_deleted"),
        @Index(name = "idx_links_target_latest_deleted", columnList = "target_entity_id, is_latest, is_deleted"),
        @Index(name = "idx_links_previous_version", columnList = "previous_version_id"),
        @Index(name = "idx_links_acl_id", columnList = "acl_id") })
public class GraphLink extends VersionedResource {

    @Column(name = "type_id")
    private UUID typeId;

    @Column(name = "source_entity_id", nullable = false)
    private UUID sourceEntityId;

    @Column(name = "target_entity_id", nullable = false)
    private UUID targetEntityId;

    public GraphLink() {
    }

    public GraphLink(UUID typeId, UUID sourceEntityId, UUID targetEntityId) {
        this.typeId = typeId;
        this.sourceEntityId = sourceEntityId;
        this.targetEntityId = targetEntityId;
    }

    @Override
    public ResourceKind getKind() {
        return ResourceKind.LINK;
    }

    public UUID getTypeId() {
        return typeId;
    }

    public void setTypeId(UUID typeId) {
        this.typeId = typeId;
    }

    public UUID getSourceEntityId() {
        return sourceEntityId;
    }

    public void setSourceEntityId(UUID sourceEntityId) {
        this.sourceEntityId = sourceEntityId;
    }

    public UUID getTargetEntityId() {
        return targetEntityId;
    }

    public void setTargetEntityId(UUID targetEntityId) {
        this.targetEntityId = targetEntityId;
    }
}
