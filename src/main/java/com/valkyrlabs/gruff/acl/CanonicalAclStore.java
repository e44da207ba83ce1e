package com.valkyrlabs.gruff.acl;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.valkyrlabs.api.AclEntryRepository;
import com.valkyrlabs.api.AclRepository;
import com.valkyrlabs.api.GraphUserRepository;
import com.valkyrlabs.api.UserGroupRepository;
import com.valkyrlabs.model.Acl;
import com.valkyrlabs.model.AclEntry;
import com.valkyrlabs.model.AclPermission;
import com.valkyrlabs.model.GraphUser;
import com.valkyrlabs.model.PrincipalType;
import com.valkyrlabs.model.UserGroup;

/**
 * Content-addressed ACL storage.
 *
 * <p>
 * An ACL row is identified by the hash of its deduplicated entries, so every
 * resource granting the same effective permissions shares one row. ACL rows are
 * never modified once written; a resource changes its permissions by pointing at
 * another ACL.
 * </p>
 *
 * <p>
 * A {@code null} ACL id means "public": no entries, every check passes.
 * </p>
 *
 * @author johnmcmahon
 */
@Service
public class CanonicalAclStore {

    protected static final Logger logger = LoggerFactory.getLogger(CanonicalAclStore.class);

    private final AclRepository aclRepository;
    private final AclEntryRepository aclEntryRepository;
    private final GraphUserRepository userRepository;
    private final UserGroupRepository groupRepository;
    private final Clock clock;

    public CanonicalAclStore(AclRepository aclRepository, AclEntryRepository aclEntryRepository,
            GraphUserRepository userRepository, UserGroupRepository groupRepository, Clock clock) {
        this.aclRepository = aclRepository;
        this.aclEntryRepository = aclEntryRepository;
        this.userRepository = userRepository;
        this.groupRepository = groupRepository;
        this.clock = clock;
    }

    /**
     * Id of the ACL granting exactly {@code entries}, creating it if no ACL with the
     * same canonical hash exists yet.
     *
     * @return the ACL id, or {@code null} for an empty list
     */
    @Transactional
    public Long getOrCreate(Collection<AclGrant> entries) {
        if (entries == null || entries.isEmpty()) {
            return null;
        }
        List<AclGrant> canonical = AclCanonicalizer.deduplicate(entries);
        String hash = AclCanonicalizer.computeHash(canonical);

        Optional<Acl> existing = aclRepository.findByHash(hash);
        if (existing.isPresent()) {
            logger.trace("Reusing ACL {} for hash {}", existing.get().getId(), hash);
            return existing.get().getId();
        }

        Acl acl = aclRepository.save(new Acl(hash, clock.instant()));
        List<AclEntry> rows = new ArrayList<>(canonical.size());
        for (AclGrant grant : canonical) {
            rows.add(new AclEntry(acl.getId(), grant.getPrincipalType(), grant.getPrincipalId(),
                    grant.getPermission()));
        }
        aclEntryRepository.saveAll(rows);
        logger.info("Created ACL {} with {} entries (hash {})", acl.getId(), rows.size(), hash);
        return acl.getId();
    }

    /**
     * ACL for a resource being created by {@code creatorId}.
     *
     * @param explicitEntries {@code null} grants WRITE to the creator only; an empty
     *                        list makes the resource public; otherwise the creator's
     *                        WRITE entry is prepended when missing
     */
    @Transactional
    public Long createForNewResource(UUID creatorId, List<AclGrant> explicitEntries) {
        if (explicitEntries == null) {
            Objects.requireNonNull(creatorId, "creatorId is required for a creator-only ACL");
            return getOrCreate(List.of(AclGrant.user(creatorId, AclPermission.WRITE)));
        }
        if (explicitEntries.isEmpty()) {
            return null;
        }
        Objects.requireNonNull(creatorId, "creatorId is required for an explicit ACL");
        AclGrant creatorWrite = AclGrant.user(creatorId, AclPermission.WRITE);
        List<AclGrant> entries = new ArrayList<>(explicitEntries.size() + 1);
        if (!explicitEntries.contains(creatorWrite)) {
            entries.add(creatorWrite);
        }
        entries.addAll(explicitEntries);
        return getOrCreate(entries);
    }

    /**
     * Stored entries ordered by principal type, principal id and permission. Empty
     * for a {@code null} or unknown ACL id.
     */
    @Transactional(readOnly = true)
    public List<AclGrant> getEntries(Long aclId) {
        if (aclId == null) {
            return List.of();
        }
        List<AclGrant> grants = new ArrayList<>();
        for (AclEntry entry : aclEntryRepository.findByAclIdOrderByPrincipalTypeAscPrincipalIdAscPermissionAsc(aclId)) {
            grants.add(AclGrant.of(entry));
        }
        return grants;
    }

    /**
     * {@link #getEntries} with each principal's name and email, looked up in one
     * batch per principal type.
     */
    @Transactional(readOnly = true)
    public List<EnrichedAclGrant> getEnrichedEntries(Long aclId) {
        List<AclGrant> grants = getEntries(aclId);
        if (grants.isEmpty()) {
            return List.of();
        }

        Map<UUID, GraphUser> users = new HashMap<>();
        for (GraphUser user : userRepository.findAllById(idsOfType(grants, PrincipalType.USER))) {
            users.put(user.getId(), user);
        }
        Map<UUID, UserGroup> groups = new HashMap<>();
        for (UserGroup group : groupRepository.findAllById(idsOfType(grants, PrincipalType.GROUP))) {
            groups.put(group.getId(), group);
        }

        List<EnrichedAclGrant> enriched = new ArrayList<>(grants.size());
        for (AclGrant grant : grants) {
            if (grant.getPrincipalType() == PrincipalType.USER) {
                GraphUser user = users.get(grant.getPrincipalId());
                if (user == null) {
                    enriched.add(new EnrichedAclGrant(grant, null, null));
                } else {
                    String name = user.getDisplayName() != null ? user.getDisplayName() : user.getEmail();
                    enriched.add(new EnrichedAclGrant(grant, name, user.getEmail()));
                }
            } else {
                UserGroup group = groups.get(grant.getPrincipalId());
                enriched.add(new EnrichedAclGrant(grant, group == null ? null : group.getName(), null));
            }
        }
        return enriched;
    }

    /**
     * Checks that every referenced user and group exists, reporting all missing
     * principals rather than the first.
     */
    @Transactional(readOnly = true)
    public PrincipalValidation validatePrincipals(Collection<AclGrant> entries) {
        if (entries == null || entries.isEmpty()) {
            return new PrincipalValidation(List.of());
        }
        List<AclGrant> grants = new ArrayList<>(entries);
        Set<UUID> knownUsers = new LinkedHashSet<>();
        userRepository.findAllById(idsOfType(grants, PrincipalType.USER)).forEach(u -> knownUsers.add(u.getId()));
        Set<UUID> knownGroups = new LinkedHashSet<>();
        groupRepository.findAllById(idsOfType(grants, PrincipalType.GROUP)).forEach(g -> knownGroups.add(g.getId()));

        List<String> errors = new ArrayList<>();
        Set<AclGrant> reported = new LinkedHashSet<>();
        for (AclGrant grant : grants) {
            AclGrant principal = new AclGrant(grant.getPrincipalType(), grant.getPrincipalId(), AclPermission.READ);
            if (!reported.add(principal)) {
                continue;
            }
            if (grant.getPrincipalType() == PrincipalType.USER && !knownUsers.contains(grant.getPrincipalId())) {
                errors.add("User not found: " + grant.getPrincipalId());
            } else if (grant.getPrincipalType() == PrincipalType.GROUP
                    && !knownGroups.contains(grant.getPrincipalId())) {
                errors.add("Group not found: " + grant.getPrincipalId());
            }
        }
        if (!errors.isEmpty()) {
            logger.warn("ACL validation failed: {}", errors);
        }
        return new PrincipalValidation(errors);
    }

    private static Set<UUID> idsOfType(List<AclGrant> grants, PrincipalType type) {
        Set<UUID> ids = new LinkedHashSet<>();
        for (AclGrant grant : grants) {
            if (grant.getPrincipalType() == type) {
                ids.add(grant.getPrincipalId());
            }
        }
        return ids;
    }
}
