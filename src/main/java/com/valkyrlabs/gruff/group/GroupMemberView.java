package com.valkyrlabs.gruff.group;

import java.time.Instant;
import java.util.UUID;

import com.valkyrlabs.model.PrincipalType;

/**
 * A direct member of a group with its display details.
 */
public class GroupMemberView {

    private final PrincipalType memberType;
    private final UUID memberId;
    private final String name;
    private final String email;
    private final Instant addedAt;

    public GroupMemberView(PrincipalType memberType, UUID memberId, String name, String email, Instant addedAt) {
        this.memberType = memberType;
        this.memberId = memberId;
        this.name = name;
        this.email = email;
        this.addedAt = addedAt;
    }

    public PrincipalType getMemberType() {
        return memberType;
    }

    public UUID getMemberId() {
        return memberId;
    }

    public String getName() {
        return name;
    }

    /** Users only. */
    public String getEmail() {
        return email;
    }

    public Instant getAddedAt() {
        return addedAt;
    }
}
