package com.valkyrlabs.model;

import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * A node of the graph. Type management lives outside this core, so the type is only
 * carried along from version to version.
 */
@Entity
@Table(name = "entities", indexes = {
        @Index(name = "idx_entities_type_latest_deleted", columnList = "type_id, is_latest, is_deleted"),
        @Index(name = "idx_entities_previous_version", columnList = "previous_version_id"),
        @Index(name = "idx_entities_acl_id", columnList = "acl_id") })
public class GraphEntity extends VersionedResource {

    @Column(name = "type_id")
    private UUID typeId;

    public GraphEntity() {
    }

    public GraphEntity(UUID typeId) {
        this.typeId = typeId;
    }

    @Override
    public ResourceKind getKind() {
        return ResourceKind.ENTITY;
    }

    public UUID getTypeId() {
        return typeId;
    }

    public void setTypeId(UUID typeId) {
        this.typeId = typeId;
    }
}
