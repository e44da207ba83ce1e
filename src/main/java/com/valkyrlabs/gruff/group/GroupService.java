package com.valkyrlabs.gruff.group;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import com.valkyrlabs.api.GraphUserRepository;
import com.valkyrlabs.api.GroupMemberRepository;
import com.valkyrlabs.api.UserGroupRepository;
import com.valkyrlabs.gruff.cache.EffectiveGroupsCache;
import com.valkyrlabs.gruff.error.Outcome;
import com.valkyrlabs.gruff.group.EffectiveMembers.EffectiveGroup;
import com.valkyrlabs.gruff.group.EffectiveMembers.EffectiveUser;
import com.valkyrlabs.gruff.group.GroupHierarchyResolver.ReachedMember;
import com.valkyrlabs.model.GraphUser;
import com.valkyrlabs.model.GroupMember;
import com.valkyrlabs.model.PrincipalType;
import com.valkyrlabs.model.UserGroup;

/**
 * Group and membership management.
 *
 * <p>
 * Group-in-group edges are only written after both the nesting depth guard and the
 * cycle guard pass. Every membership change bumps the effective group cache
 * version once the transaction commits.
 * </p>
 *
 * @author johnmcmahon
 */
@Service
public class GroupService {

    public static final String GROUP_NAME_EXISTS = "GROUP_NAME_EXISTS";
    public static final String MAX_NESTING_DEPTH_EXCEEDED = "MAX_NESTING_DEPTH_EXCEEDED";
    public static final String CIRCULAR_MEMBERSHIP = "CIRCULAR_MEMBERSHIP";
    public static final String MEMBER_ALREADY_EXISTS = "MEMBER_ALREADY_EXISTS";

    protected static final Logger logger = LoggerFactory.getLogger(GroupService.class);

    private final UserGroupRepository groupRepository;
    private final GroupMemberRepository memberRepository;
    private final GraphUserRepository userRepository;
    private final GroupHierarchyResolver resolver;
    private final EffectiveGroupsCache effectiveGroupsCache;
    private final Clock clock;

    public GroupService(UserGroupRepository groupRepository, GroupMemberRepository memberRepository,
            GraphUserRepository userRepository, GroupHierarchyResolver resolver,
            EffectiveGroupsCache effectiveGroupsCache, Clock clock) {
        this.groupRepository = groupRepository;
        this.memberRepository = memberRepository;
        this.userRepository = userRepository;
        this.resolver = resolver;
        this.effectiveGroupsCache = effectiveGroupsCache;
        this.clock = clock;
    }

    @Transactional
    public Outcome<UserGroup> createGroup(String name, String description, UUID creatorId) {
        if (groupRepository.existsByName(name)) {
            logger.warn("Group name already taken: {}", name);
            return Outcome.conflict(GROUP_NAME_EXISTS, "Group with this name already exists");
        }
        UserGroup group = groupRepository
                .save(new UserGroup(UUID.randomUUID(), name, description, clock.instant(), creatorId));
        logger.info("Created group {} ({})", group.getId(), name);
        return Outcome.ok(group);
    }

    /**
     * Renames and/or redescribes a group; {@code null} arguments leave the field
     * unchanged.
     */
    @Transactional
    public Outcome<UserGroup> updateGroup(UUID groupId, String name, String description) {
        Optional<UserGroup> found = groupRepository.findById(groupId);
        if (found.isEmpty()) {
            return Outcome.notFound("Group");
        }
        UserGroup group = found.get();
        if (name != null && !name.equals(group.getName())) {
            if (groupRepository.existsByName(name)) {
                logger.warn("Cannot rename group {}: name {} already taken", groupId, name);
                return Outcome.conflict(GROUP_NAME_EXISTS, "Group with this name already exists");
            }
            group.setName(name);
        }
        if (description != null) {
            group.setDescription(description);
        }
        logger.info("Updated group {}", groupId);
        return Outcome.ok(groupRepository.save(group));
    }

    /**
     * Deletes a group together with every membership edge it takes part in, as
     * container or as member.
     */
    @Transactional
    public Outcome<UserGroup> deleteGroup(UUID groupId) {
        Optional<UserGroup> found = groupRepository.findById(groupId);
        if (found.isEmpty()) {
            return Outcome.notFound("Group");
        }
        int edges = memberRepository.deleteAllEdgesOf(groupId, PrincipalType.GROUP);
        groupRepository.delete(found.get());
        invalidateEffectiveGroups();
        logger.info("Deleted group {} and {} membership edges", groupId, edges);
        return Outcome.ok(found.get());
    }

    @Transactional
    public Outcome<GroupMember> addMember(UUID groupId, PrincipalType memberType, UUID memberId, UUID actorId) {
        if (!groupRepository.existsById(groupId)) {
            return Outcome.notFound("Group");
        }
        if (memberType == PrincipalType.USER && !userRepository.existsById(memberId)) {
            logger.warn("Cannot add unknown user {} to group {}", memberId, groupId);
            return Outcome.notFound("User");
        }
        if (memberType == PrincipalType.GROUP) {
            if (!groupRepository.existsById(memberId)) {
                logger.warn("Cannot add unknown group {} to group {}", memberId, groupId);
                return Outcome.notFound("Group");
            }
            if (resolver.wouldExceedMaxDepth(groupId, memberId)) {
                logger.warn("Adding group {} to {} would exceed max nesting depth", memberId, groupId);
                return Outcome.conflict(MAX_NESTING_DEPTH_EXCEEDED,
                        "Cannot add group as member: would exceed maximum nesting depth of "
                                + resolver.getMaxNestingDepth());
            }
            if (resolver.wouldCreateCycle(groupId, memberId)) {
                logger.warn("Adding group {} to {} would create a cycle", memberId, groupId);
                return Outcome.conflict(CIRCULAR_MEMBERSHIP,
                        "Cannot add group as member: would create a circular membership");
            }
        }
        if (memberRepository.existsByGroupIdAndMemberTypeAndMemberId(groupId, memberType, memberId)) {
            logger.warn("{} {} already in group {}", memberType, memberId, groupId);
            return Outcome.conflict(MEMBER_ALREADY_EXISTS, "Member already exists in group");
        }

        GroupMember edge = memberRepository
                .save(new GroupMember(groupId, memberType, memberId, clock.instant(), actorId));
        invalidateEffectiveGroups();
        logger.info("Added {} {} to group {}", memberType, memberId, groupId);
        return Outcome.ok(edge);
    }

    @Transactional
    public Outcome<GroupMember> removeMember(UUID groupId, PrincipalType memberType, UUID memberId) {
        if (!groupRepository.existsById(groupId)) {
            return Outcome.notFound("Group");
        }
        Optional<GroupMember> edge = memberRepository.findByGroupIdAndMemberTypeAndMemberId(groupId, memberType,
                memberId);
        if (edge.isEmpty()) {
            return Outcome.notFound("Member in group");
        }
        memberRepository.delete(edge.get());
        invalidateEffectiveGroups();
        logger.info("Removed {} {} from group {}", memberType, memberId, groupId);
        return Outcome.ok(edge.get());
    }

    @Transactional(readOnly = true)
    public Outcome<List<GroupMemberView>> listMembers(UUID groupId) {
        if (!groupRepository.existsById(groupId)) {
            return Outcome.notFound("Group");
        }
        List<GroupMember> edges = memberRepository.findByGroupIdOrderByCreatedAtAsc(groupId);
        Set<UUID> userIds = new LinkedHashSet<>();
        Set<UUID> groupIds = new LinkedHashSet<>();
        for (GroupMember edge : edges) {
            (edge.getMemberType() == PrincipalType.USER ? userIds : groupIds).add(edge.getMemberId());
        }
        Map<UUID, GraphUser> users = usersById(userIds);
        Map<UUID, UserGroup> groups = groupsById(groupIds);

        List<GroupMemberView> views = new ArrayList<>(edges.size());
        for (GroupMember edge : edges) {
            if (edge.getMemberType() == PrincipalType.USER) {
                GraphUser user = users.get(edge.getMemberId());
                views.add(new GroupMemberView(PrincipalType.USER, edge.getMemberId(),
                        user == null ? null : user.getDisplayName(), user == null ? null : user.getEmail(),
                        edge.getCreatedAt()));
            } else {
                UserGroup group = groups.get(edge.getMemberId());
                views.add(new GroupMemberView(PrincipalType.GROUP, edge.getMemberId(),
                        group == null ? null : group.getName(), null, edge.getCreatedAt()));
            }
        }
        return Outcome.ok(views);
    }

    @Transactional(readOnly = true)
    public Outcome<EffectiveMembers> effectiveMembers(UUID groupId) {
        if (!groupRepository.existsById(groupId)) {
            return Outcome.notFound("Group");
        }
        List<ReachedMember> reached = resolver.transitiveMembers(groupId);
        Set<UUID> userIds = new LinkedHashSet<>();
        Set<UUID> groupIds = new LinkedHashSet<>();
        for (ReachedMember member : reached) {
            (member.getMemberType() == PrincipalType.USER ? userIds : groupIds).add(member.getMemberId());
        }
        Map<UUID, GraphUser> users = usersById(userIds);
        Map<UUID, UserGroup> groups = groupsById(groupIds);

        Map<UUID, EffectiveUser> uniqueUsers = new LinkedHashMap<>();
        List<EffectiveGroup> nested = new ArrayList<>();
        for (ReachedMember member : reached) {
            if (member.getMemberType() == PrincipalType.USER) {
                GraphUser user = users.get(member.getMemberId());
                uniqueUsers.computeIfAbsent(member.getMemberId(), id -> new EffectiveUser(id,
                        user == null ? null : user.getDisplayName(), user == null ? null : user.getEmail()))
                        .addPath(member.getPath());
            } else {
                UserGroup group = groups.get(member.getMemberId());
                nested.add(new EffectiveGroup(member.getMemberId(), group == null ? null : group.getName(),
                        member.getPath()));
            }
        }
        logger.debug("Group {} has {} effective users and {} nested groups", groupId, uniqueUsers.size(),
                nested.size());
        return Outcome.ok(new EffectiveMembers(new ArrayList<>(uniqueUsers.values()), nested));
    }

    /**
     * Uncached effective group computation; callers normally go through the
     * permission evaluator, which caches it.
     */
    public Set<UUID> resolveEffectiveGroups(UUID userId) {
        return resolver.resolveEffectiveGroups(userId);
    }

    private void invalidateEffectiveGroups() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    effectiveGroupsCache.invalidateAll();
                }
            });
        } else {
            effectiveGroupsCache.invalidateAll();
        }
    }

    private Map<UUID, GraphUser> usersById(Set<UUID> ids) {
        Map<UUID, GraphUser> users = new HashMap<>();
        for (GraphUser user : userRepository.findAllById(ids)) {
            users.put(user.getId(), user);
        }
        return users;
    }

    private Map<UUID, UserGroup> groupsById(Set<UUID> ids) {
        Map<UUID, UserGroup> groups = new HashMap<>();
        for (UserGroup group : groupRepository.findAllById(ids)) {
            groups.put(group.getId(), group);
        }
        return groups;
    }
}
