package com.valkyrlabs.model;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * A deduplicated permission set. Immutable once written; its meaning is the set of
 * {@link AclEntry} rows pointing at it and it is found again by {@link #getHash()}.
 */
@Entity
@Table(name = "acls")
public class Acl {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hash", nullable = false, unique = true, length = 64)
    private String hash;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected Acl() {
    }

    public Acl(String hash, Instant createdAt) {
        this.hash = hash;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getHash() {
        return hash;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "Acl[" + id + ":" + hash + "]";
    }
}
