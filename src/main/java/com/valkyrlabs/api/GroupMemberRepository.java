package com.valkyrlabs.api;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;

import com.valkyrlabs.model.GroupMember;
import com.valkyrlabs.model.PrincipalType;

/**
 * Membership edges. The hierarchy walks in the resolver are built from the two
 * projections below: "who contains X" and "what groups does X contain".
 */
public interface GroupMemberRepository extends CrudRepository<GroupMember, Long> {

        /**
         * Groups that directly contain the given member.
         */
        @Query("select m.groupId from GroupMember m where m.memberType = :memberType and m.memberId = :memberId")
        List<UUID> findGroupIdsContaining(@Param("memberType") PrincipalType memberType,
                        @Param("memberId") UUID memberId);

        /**
         * Member ids of one type directly inside a group.
         */
        @Query("select m.memberId from GroupMember m where m.groupId = :groupId and m.memberType = :memberType")
        List<UUID> findMemberIds(@Param("groupId") UUID groupId, @Param("memberType") PrincipalType memberType);

        List<GroupMember> findByGroupIdOrderByCreatedAtAsc(UUID groupId);

        Optional<GroupMember> findByGroupIdAndMemberTypeAndMemberId(UUID groupId, PrincipalType memberType,
                        UUID memberId);

        boolean existsByGroupIdAndMemberTypeAndMemberId(UUID groupId, PrincipalType memberType, UUID memberId);

        @Modifying
        @Query("delete from GroupMember m where m.groupId = :groupId or (m.memberType = :memberType and m.memberId = :groupId)")
        int deleteAllEdgesOf(@Param("groupId") UUID groupId, @Param("memberType") PrincipalType memberType);
}
