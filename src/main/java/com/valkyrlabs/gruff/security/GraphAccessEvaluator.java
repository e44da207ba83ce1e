package com.valkyrlabs.gruff.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import java.util.UUID;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.valkyrlabs.api.AclEntryRepository;
import com.valkyrlabs.gruff.cache.EffectiveGroupsCache;
import com.valkyrlabs.gruff.config.GruffProperties;
import com.valkyrlabs.gruff.group.GroupHierarchyResolver;
import com.valkyrlabs.model.AclPermission;
import com.valkyrlabs.model.AclScoped;
import com.valkyrlabs.model.PrincipalType;

/**
 * Decides whether a user holds a permission on ACL-scoped rows.
 *
 * <p>
 * A user's principals are the user itself plus its effective groups (cached). A
 * check for READ is satisfied by READ or WRITE entries. A row without an ACL is
 * public and passes every check, including for callers without a user id; any
 * other row is denied to such callers.
 * </p>
 *
 * @author johnmcmahon
 */
@Component
public class GraphAccessEvaluator {

    protected static final Logger logger = LoggerFactory.getLogger(GraphAccessEvaluator.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final AclEntryRepository aclEntryRepository;
    private final GroupHierarchyResolver groupResolver;
    private final EffectiveGroupsCache effectiveGroupsCache;
    private final int inClauseThreshold;

    @Autowired
    public GraphAccessEvaluator(AclEntryRepository aclEntryRepository, GroupHierarchyResolver groupResolver,
            EffectiveGroupsCache effectiveGroupsCache, GruffProperties properties) {
        this(aclEntryRepository, groupResolver, effectiveGroupsCache, properties.getAcl().getInClauseThreshold());
    }

    public GraphAccessEvaluator(AclEntryRepository aclEntryRepository, GroupHierarchyResolver groupResolver,
            EffectiveGroupsCache effectiveGroupsCache, int inClauseThreshold) {
        this.aclEntryRepository = aclEntryRepository;
        this.groupResolver = groupResolver;
        this.effectiveGroupsCache = effectiveGroupsCache;
        this.inClauseThreshold = inClauseThreshold;
    }

    public int getInClauseThreshold() {
        return inClauseThreshold;
    }

    public Set<UUID> effectiveGroups(UUID userId) {
        return effectiveGroupsCache.get(userId, () -> groupResolver.resolveEffectiveGroups(userId));
    }

    /**
     * Ids of every ACL that grants {@code permission} to {@code userId} directly or
     * through one of its effective groups. Empty for a {@code null} user.
     */
    @Transactional(readOnly = true)
    public Set<Long> accessibleAclIds(UUID userId, AclPermission permission) {
        if (userId == null) {
            return Collections.emptySet();
        }
        Set<AclPermission> granting = permission.grantedBy();
        Set<Long> aclIds = new LinkedHashSet<>(
                aclEntryRepository.findAclIdsGranting(PrincipalType.USER, List.of(userId), granting));
        Set<UUID> groups = effectiveGroups(userId);
        if (!groups.isEmpty()) {
            aclIds.addAll(aclEntryRepository.findAclIdsGranting(PrincipalType.GROUP, groups, granting));
        }
        logger.trace("User {} has {} on {} ACLs via {} groups", userId, permission, aclIds.size(), groups.size());
        return aclIds;
    }

    public boolean hasPermission(Long aclId, UUID userId, AclPermission permission) {
        if (aclId == null) {
            return true;
        }
        if (userId == null) {
            logger.trace("Anonymous caller denied {} on ACL {}", permission, aclId);
            return false;
        }
        boolean granted = accessibleAclIds(userId, permission).contains(aclId);
        logger.trace("{} {} on ACL {} -> {}", userId, permission, aclId, granted ? "granted" : "denied");
        return granted;
    }

    /**
     * Predicate restricting rows whose ACL reference lives in {@code aclColumn} to
     * those {@code userId} may access with {@code permission}.
     *
     * @throws IllegalArgumentException if {@code aclColumn} is not a plain
     *                                  (optionally qualified) identifier
     */
    public AclListFilter buildListFilter(UUID userId, AclPermission permission, String aclColumn) {
        if (aclColumn == null || !IDENTIFIER.matcher(aclColumn).matches()) {
            throw new IllegalArgumentException("Invalid ACL column name: " + aclColumn);
        }
        Set<Long> accessible = accessibleAclIds(userId, permission);
        if (accessible.size() > inClauseThreshold) {
            logger.debug("{} accessible ACLs exceed IN threshold {}, filtering after fetch", accessible.size(),
                    inClauseThreshold);
            return new AclListFilter(false, null, List.of(), accessible);
        }
        if (accessible.isEmpty()) {
            return new AclListFilter(true, aclColumn + " IS NULL", List.of(), accessible);
        }
        StringJoiner placeholders = new StringJoiner(", ", "(", ")");
        List<Object> bindings = new ArrayList<>(accessible.size());
        for (Long id : accessible) {
            placeholders.add("?");
            bindings.add(id);
        }
        String clause = "(" + aclColumn + " IS NULL OR " + aclColumn + " IN " + placeholders + ")";
        return new AclListFilter(true, clause, bindings, accessible);
    }

    /**
     * Rows that are public or whose ACL is in {@code accessibleAclIds}, in input
     * order.
     */
    public static <T extends AclScoped> List<T> filterByPermission(Collection<T> rows, Set<Long> accessibleAclIds) {
        List<T> admitted = new ArrayList<>(rows.size());
        for (T row : rows) {
            if (row.getAclId() == null || accessibleAclIds.contains(row.getAclId())) {
                admitted.add(row);
            }
        }
        return admitted;
    }
}
