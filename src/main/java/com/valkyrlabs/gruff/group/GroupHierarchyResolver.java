package com.valkyrlabs.gruff.group;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.valkyrlabs.api.GroupMemberRepository;
import com.valkyrlabs.gruff.config.GruffProperties;
import com.valkyrlabs.model.GroupMember;
import com.valkyrlabs.model.PrincipalType;

/**
 * Walks the group hierarchy stored in {@code group_members}.
 *
 * <p>
 * The hierarchy is a directed graph that may already contain cycles written before
 * the guards existed, so every walk tracks visited groups and terminates on them.
 * </p>
 */
@Component
public class GroupHierarchyResolver {

    protected static final Logger logger = LoggerFactory.getLogger(GroupHierarchyResolver.class);

    private final GroupMemberRepository memberRepository;
    private final int maxNestingDepth;

    @Autowired
    public GroupHierarchyResolver(GroupMemberRepository memberRepository, GruffProperties properties) {
        this(memberRepository, properties.getGroups().getMaxNestingDepth());
    }

    public GroupHierarchyResolver(GroupMemberRepository memberRepository, int maxNestingDepth) {
        this.memberRepository = memberRepository;
        this.maxNestingDepth = maxNestingDepth;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    /**
     * Whether making {@code memberGroupId} a member of {@code parentGroupId} closes a
     * cycle.
     */
    @Transactional(readOnly = true)
    public boolean wouldCreateCycle(UUID parentGroupId, UUID memberGroupId) {
        return wouldCreateCycle(parentGroupId, memberGroupId, 0);
    }

    /**
     * Walks up from {@code parentGroupId} through the groups containing it. Reaching
     * {@code memberGroupId} is a cycle; so is climbing {@code maxNestingDepth}
     * levels without reaching the top.
     */
    public boolean wouldCreateCycle(UUID parentGroupId, UUID memberGroupId, int depth) {
        if (depth >= maxNestingDepth) {
            logger.trace("Ancestor walk from {} hit depth {}, treating as cycle", parentGroupId, depth);
            return true;
        }
        if (parentGroupId.equals(memberGroupId)) {
            return true;
        }
        for (UUID container : memberRepository.findGroupIdsContaining(PrincipalType.GROUP, parentGroupId)) {
            if (container.equals(memberGroupId)) {
                return true;
            }
            if (wouldCreateCycle(container, memberGroupId, depth + 1)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Length of the longest chain of nested groups below {@code groupId}; 0 for a
     * group without group members.
     */
    @Transactional(readOnly = true)
    public int nestingDepth(UUID groupId) {
        return nestingDepth(groupId, new HashSet<>());
    }

    private int nestingDepth(UUID groupId, Set<UUID> visited) {
        if (!visited.add(groupId)) {
            return 0;
        }
        int deepest = 0;
        boolean hasChildren = false;
        for (UUID child : memberRepository.findMemberIds(groupId, PrincipalType.GROUP)) {
            hasChildren = true;
            deepest = Math.max(deepest, nestingDepth(child, new HashSet<>(visited)));
        }
        return hasChildren ? deepest + 1 : 0;
    }

    /**
     * Length of the longest chain of groups containing {@code groupId}; 0 for a
     * top-level group.
     */
    @Transactional(readOnly = true)
    public int ancestorHeight(UUID groupId) {
        return ancestorHeight(groupId, new HashSet<>());
    }

    private int ancestorHeight(UUID groupId, Set<UUID> visited) {
        if (!visited.add(groupId)) {
            return 0;
        }
        int highest = 0;
        boolean hasParents = false;
        for (UUID parent : memberRepository.findGroupIdsContaining(PrincipalType.GROUP, groupId)) {
            hasParents = true;
            highest = Math.max(highest, ancestorHeight(parent, new HashSet<>(visited)));
        }
        return hasParents ? highest + 1 : 0;
    }

    /**
     * Whether adding {@code memberGroupId} under {@code parentGroupId} would produce a
     * chain longer than the configured maximum.
     */
    @Transactional(readOnly = true)
    public boolean wouldExceedMaxDepth(UUID parentGroupId, UUID memberGroupId) {
        int height = ancestorHeight(parentGroupId);
        int depth = nestingDepth(memberGroupId);
        logger.trace("Nesting {} under {}: ancestor height {}, member depth {}", memberGroupId, parentGroupId,
                height, depth);
        return height + 1 + depth > maxNestingDepth;
    }

    /**
     * Every group {@code userId} belongs to, directly or through nested groups.
     */
    @Transactional(readOnly = true)
    public Set<UUID> resolveEffectiveGroups(UUID userId) {
        Set<UUID> visited = new LinkedHashSet<>();
        Deque<UUID> pending = new ArrayDeque<>(memberRepository.findGroupIdsContaining(PrincipalType.USER, userId));
        while (!pending.isEmpty()) {
            UUID groupId = pending.poll();
            if (!visited.add(groupId)) {
                continue;
            }
            for (UUID container : memberRepository.findGroupIdsContaining(PrincipalType.GROUP, groupId)) {
                if (!visited.contains(container)) {
                    pending.add(container);
                }
            }
        }
        logger.trace("Resolved {} effective groups for user {}", visited.size(), userId);
        return visited;
    }

    /**
     * Transitive members of {@code groupId}. Each edge is reported with the path of
     * group ids leading to it, starting at {@code groupId}; a member reachable by
     * several paths is reported once per path.
     */
    @Transactional(readOnly = true)
    public List<ReachedMember> transitiveMembers(UUID groupId) {
        List<ReachedMember> reached = new ArrayList<>();
        collect(groupId, new ArrayList<>(), new HashSet<>(), reached);
        return reached;
    }

    private void collect(UUID groupId, List<UUID> pathToGroup, Set<UUID> visited, List<ReachedMember> reached) {
        if (!visited.add(groupId)) {
            return;
        }
        List<UUID> path = new ArrayList<>(pathToGroup);
        path.add(groupId);
        for (GroupMember edge : memberRepository.findByGroupIdOrderByCreatedAtAsc(groupId)) {
            reached.add(new ReachedMember(edge.getMemberType(), edge.getMemberId(), List.copyOf(path)));
            if (edge.getMemberType() == PrincipalType.GROUP) {
                collect(edge.getMemberId(), path, new HashSet<>(visited), reached);
            }
        }
    }

    /**
     * A member found while descending the hierarchy, with the groups passed on the
     * way.
     */
    public static final class ReachedMember {
        private final PrincipalType memberType;
        private final UUID memberId;
        private final List<UUID> path;

        public ReachedMember(PrincipalType memberType, UUID memberId, List<UUID> path) {
            this.memberType = memberType;
            this.memberId = memberId;
            this.path = path;
        }

        public PrincipalType getMemberType() {
            return memberType;
        }

        public UUID getMemberId() {
            return memberId;
        }

        public List<UUID> getPath() {
            return path;
        }
    }
}
