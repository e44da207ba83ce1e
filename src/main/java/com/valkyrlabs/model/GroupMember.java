package com.valkyrlabs.model;

import java.time.Instant;
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
 * Membership edge: {@code groupId} contains the user or group {@code memberId}.
 * Group-typed edges form the directed group hierarchy.
 */
@Entity
@Table(name = "group_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_group_members_edge",
                columnNames = { "group_id", "member_type", "member_id" }),
        indexes = @Index(name = "idx_group_members_member", columnList = "member_type, member_id"))
public class GroupMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "group_id", nullable = false)
    private UUID groupId;

    @Convert(converter = PrincipalTypeConverter.class)
    @Column(name = "member_type", nullable = false, length = 16)
    private PrincipalType memberType;

    @Column(name = "member_id", nullable = false)
    private UUID memberId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "created_by")
    private UUID createdBy;

    protected GroupMember() {
    }

    public GroupMember(UUID groupId, PrincipalType memberType, UUID memberId, Instant createdAt, UUID createdBy) {
        this.groupId = groupId;
        this.memberType = memberType;
        this.memberId = memberId;
        this.createdAt = createdAt;
        this.createdBy = createdBy;
    }

    public Long getId() {
        return id;
    }

    public UUID getGroupId() {
        return groupId;
    }

    public PrincipalType getMemberType() {
        return memberType;
    }

    public UUID getMemberId() {
        return memberId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    @Override
    public String toString() {
        return groupId + " -> " + memberType + ":" + memberId;
    }
}
