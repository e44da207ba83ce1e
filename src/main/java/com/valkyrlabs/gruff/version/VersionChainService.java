package com.valkyrlabs.gruff.version;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.transaction.annotation.Transactional;

import com.valkyrlabs.api.VersionedResourceRepository;
import com.valkyrlabs.gruff.acl.AclGrant;
import com.valkyrlabs.gruff.acl.CanonicalAclStore;
import com.valkyrlabs.gruff.acl.PrincipalValidation;
import com.valkyrlabs.gruff.config.GruffProperties;
import com.valkyrlabs.gruff.error.Outcome;
import com.valkyrlabs.gruff.security.AclListFilter;
import com.valkyrlabs.gruff.security.GraphAccessEvaluator;
import com.valkyrlabs.model.AclPermission;
import com.valkyrlabs.model.VersionedResource;

/**
 * Append-only version chains for one resource kind.
 *
 * <p>
 * Rows are never modified after insert except for clearing {@code latest}. Every
 * mutation supersedes the current latest row and appends its successor in one
 * transaction. The supersede is conditional on the row still being latest, so of
 * two writers racing on the same chain exactly one appends and the other gets a
 * {@link #CONCURRENT_MODIFICATION} conflict.
 * </p>
 *
 * <p>
 * Any id of a chain, including ids of superseded versions, addresses the chain.
 * </p>
 *
 * @param <T> the resource kind
 */
public abstract class VersionChainService<T extends VersionedResource> {

    public static final String RESOURCE_DELETED = "RESOURCE_DELETED";
    public static final String ALREADY_DELETED = "ALREADY_DELETED";
    public static final String NOT_DELETED = "NOT_DELETED";
    public static final String CONCURRENT_MODIFICATION = "CONCURRENT_MODIFICATION";

    protected static final Logger logger = LoggerFactory.getLogger(VersionChainService.class);

    private static final String ACL_COLUMN = "acl_id";
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    protected final VersionedResourceRepository<T> repository;
    protected final CanonicalAclStore aclStore;
    protected final GraphAccessEvaluator access;
    protected final Clock clock;
    private final int overFetchFactor;

    protected VersionChainService(VersionedResourceRepository<T> repository, CanonicalAclStore aclStore,
            GraphAccessEvaluator access, GruffProperties properties, Clock clock) {
        this.repository = repository;
        this.aclStore = aclStore;
        this.access = access;
        this.clock = clock;
        this.overFetchFactor = properties.getAcl().getOverFetchFactor();
    }

    /**
     * A new, unsaved row carrying the kind-specific fields of {@code source}.
     */
    protected abstract T copyOf(T source);

    /** Display name used in messages, e.g. "Entity". */
    protected abstract String resourceName();

    /**
     * Kind-specific validation of a draft before it is created.
     */
    protected Outcome<T> checkDraft(T draft) {
        return Outcome.ok(draft);
    }

    /**
     * Creates version 1 of a new chain.
     *
     * @param explicitAcl {@code null} for a creator-only ACL, empty for public
     */
    @Transactional
    public Outcome<T> create(T draft, UUID creatorId, List<AclGrant> explicitAcl) {
        if (creatorId == null) {
            return Outcome.forbidden("Authentication required to create " + lowerName());
        }
        Outcome<T> checked = checkDraft(draft);
        if (!checked.isOk()) {
            return checked;
        }
        if (explicitAcl != null && !explicitAcl.isEmpty()) {
            PrincipalValidation validation = aclStore.validatePrincipals(explicitAcl);
            if (!validation.isValid()) {
                return Outcome.invalid(validation.getErrors());
            }
        }
        Long aclId = aclStore.createForNewResource(creatorId, explicitAcl);

        draft.setId(UUID.randomUUID());
        draft.setVersion(1);
        draft.setPreviousVersionId(null);
        draft.setLatest(true);
        draft.setDeleted(false);
        draft.setAclId(aclId);
        draft.setCreatedAt(now());
        draft.setCreatedBy(creatorId);
        T saved = repository.save(draft);
        logger.info("Created {} {} (acl {})", lowerName(), saved.getId(), aclId);
        return Outcome.ok(saved);
    }

    /**
     * Latest row of the chain containing {@code anyId}, or {@code null}. No
     * permission check.
     */
    @Transactional(readOnly = true)
    public T findLatest(UUID anyId) {
        Optional<T> direct = repository.findByIdAndLatestTrue(anyId);
        if (direct.isPresent()) {
            return direct.get();
        }
        Set<UUID> visited = new HashSet<>();
        UUID current = anyId;
        while (visited.add(current)) {
            List<T> successors = repository.findByPreviousVersionId(current);
            if (successors.isEmpty()) {
                return null;
            }
            T next = successors.get(0);
            for (T candidate : successors) {
                if (candidate.isLatest()) {
                    next = candidate;
                }
            }
            if (next.isLatest()) {
                logger.trace("Resolved {} {} to latest {}", lowerName(), anyId, next.getId());
                return next;
            }
            current = next.getId();
        }
        logger.warn("Version chain of {} {} loops without a latest row", lowerName(), anyId);
        return null;
    }

    /**
     * Every version of the chain containing {@code anyId}, ordered by version. Empty
     * when {@code anyId} is unknown. No permission check.
     */
    @Transactional(readOnly = true)
    public List<T> allVersions(UUID anyId) {
        Optional<T> start = repository.findById(anyId);
        if (start.isEmpty()) {
            return List.of();
        }

        Set<UUID> visited = new HashSet<>();
        T root = start.get();
        visited.add(root.getId());
        while (root.getPreviousVersionId() != null) {
            Optional<T> previous = repository.findById(root.getPreviousVersionId());
            if (previous.isEmpty() || !visited.add(previous.get().getId())) {
                break;
            }
            root = previous.get();
        }

        List<T> versions = new ArrayList<>();
        Set<UUID> collected = new HashSet<>();
        T current = root;
        while (current != null && collected.add(current.getId())) {
            versions.add(current);
            List<T> successors = repository.findByPreviousVersionId(current.getId());
            current = successors.isEmpty() ? null : successors.get(0);
        }
        versions.sort(Comparator.comparingInt(VersionedResource::getVersion));
        return versions;
    }

    @Transactional(readOnly = true)
    public Outcome<T> read(UUID anyId, UUID callerId) {
        T latest = findLatest(anyId);
        if (latest == null) {
            return Outcome.notFound(resourceName());
        }
        Outcome<T> denied = checkRead(latest, callerId);
        return denied != null ? denied : Outcome.ok(latest);
    }

    /**
     * Version {@code version} of the chain, subject to read permission on the
     * chain's current ACL.
     */
    @Transactional(readOnly = true)
    public Outcome<T> findVersion(UUID anyId, int version, UUID callerId) {
        T latest = findLatest(anyId);
        if (latest == null) {
            return Outcome.notFound(resourceName());
        }
        Outcome<T> denied = checkRead(latest, callerId);
        if (denied != null) {
            return denied;
        }
        for (T row : allVersions(latest.getId())) {
            if (row.getVersion() == version) {
                return Outcome.ok(row);
            }
        }
        return Outcome.notFound(resourceName() + " version " + version);
    }

    /**
     * All versions, each with its property delta against the one before.
     */
    @Transactional(readOnly = true)
    public Outcome<List<VersionHistoryEntry<T>>> history(UUID anyId, UUID callerId) {
        T latest = findLatest(anyId);
        if (latest == null) {
            return Outcome.notFound(resourceName());
        }
        Outcome<T> denied = checkRead(latest, callerId);
        if (denied != null) {
            return denied.map(row -> null);
        }
        List<T> versions = allVersions(latest.getId());
        List<VersionHistoryEntry<T>> history = new ArrayList<>(versions.size());
        T previous = null;
        for (T row : versions) {
            PropertyDiff diff = previous == null ? null
                    : PropertyDiff.between(previous.getProperties(), row.getProperties());
            history.add(new VersionHistoryEntry<>(row, diff));
            previous = row;
        }
        return Outcome.ok(history);
    }

    @Transactional
    public Outcome<T> update(UUID anyId, Map<String, Object> properties, UUID callerId) {
        T latest = findLatest(anyId);
        if (latest == null) {
            return Outcome.notFound(resourceName());
        }
        Outcome<T> denied = checkWrite(latest, callerId, "update");
        if (denied != null) {
            return denied;
        }
        if (latest.isDeleted()) {
            logger.warn("Refusing update of deleted {} {}", lowerName(), latest.getId());
            return Outcome.conflict(RESOURCE_DELETED,
                    "Cannot update deleted " + lowerName() + ". Restore it first.");
        }
        return append(latest, callerId, row -> row.setProperties(properties));
    }

    @Transactional
    public Outcome<T> delete(UUID anyId, UUID callerId) {
        T latest = findLatest(anyId);
        if (latest == null) {
            return Outcome.notFound(resourceName());
        }
        Outcome<T> denied = checkWrite(latest, callerId, "delete");
        if (denied != null) {
            return denied;
        }
        if (latest.isDeleted()) {
            return Outcome.conflict(ALREADY_DELETED, resourceName() + " is already deleted");
        }
        return append(latest, callerId, row -> row.setDeleted(true));
    }

    @Transactional
    public Outcome<T> restore(UUID anyId, UUID callerId) {
        T latest = findLatest(anyId);
        if (latest == null) {
            return Outcome.notFound(resourceName());
        }
        Outcome<T> denied = checkWrite(latest, callerId, "restore");
        if (denied != null) {
            return denied;
        }
        if (!latest.isDeleted()) {
            return Outcome.conflict(NOT_DELETED, resourceName() + " is not deleted");
        }
        return append(latest, callerId, row -> row.setDeleted(false));
    }

    /**
     * Points the chain at the ACL for {@code entries}; an empty list makes it
     * public. Returns the current row unchanged when the ACL is the same.
     */
    @Transactional
    public Outcome<T> setAcl(UUID anyId, List<AclGrant> entries, UUID callerId) {
        T latest = findLatest(anyId);
        if (latest == null) {
            return Outcome.notFound(resourceName());
        }
        Outcome<T> denied = checkWrite(latest, callerId, "modify");
        if (denied != null) {
            return denied;
        }
        if (latest.isDeleted()) {
            return Outcome.conflict(RESOURCE_DELETED,
                    "Cannot set ACL on deleted " + lowerName() + ". Restore it first.");
        }
        List<AclGrant> grants = entries == null ? List.of() : entries;
        PrincipalValidation validation = aclStore.validatePrincipals(grants);
        if (!validation.isValid()) {
            return Outcome.invalid(validation.getErrors());
        }
        Long aclId = aclStore.getOrCreate(grants);
        if (Objects.equals(aclId, latest.getAclId())) {
            logger.debug("ACL of {} {} unchanged", lowerName(), latest.getId());
            return Outcome.ok(latest);
        }
        return append(latest, callerId, row -> row.setAclId(aclId));
    }

    /**
     * First page of the latest rows readable by {@code callerId}, newest first.
     */
    @Transactional(readOnly = true)
    public ResourcePage<T> listLatest(UUID callerId, int limit, boolean includeDeleted) {
        return listLatest(callerId, limit, includeDeleted, null);
    }

    /**
     * Latest rows readable by {@code callerId}, newest first, starting after
     * {@code cursor} ({@code null} for the first page).
     *
     * <p>
     * When the caller's accessible ACLs are too many for an IN list, windows of
     * {@code (limit + 1) * overFetchFactor} rows are read and filtered until the
     * page is full or the table is exhausted, so both paths return the same rows.
     * </p>
     */
    @Transactional(readOnly = true)
    public ResourcePage<T> listLatest(UUID callerId, int limit, boolean includeDeleted, PageCursor cursor) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        Specification<T> spec = latestOnly();
        if (!includeDeleted) {
            spec = spec.and(notDeleted());
        }
        AclListFilter filter = access.buildListFilter(callerId, AclPermission.READ, ACL_COLUMN);
        List<T> rows;
        if (filter.isUseFilter()) {
            rows = fetchWindow(spec.and(aclIn(filter.getAccessibleAclIds())), cursor, limit + 1);
        } else {
            rows = fetchFiltered(spec, cursor, limit, filter.getAccessibleAclIds());
        }
        boolean hasMore = rows.size() > limit;
        List<T> items = hasMore ? rows.subList(0, limit) : rows;
        PageCursor next = hasMore ? PageCursor.after(items.get(items.size() - 1)) : null;
        return new ResourcePage<>(items, hasMore, next);
    }

    private List<T> fetchFiltered(Specification<T> spec, PageCursor cursor, int limit, Set<Long> accessibleAclIds) {
        int window = (limit + 1) * overFetchFactor;
        List<T> admitted = new ArrayList<>(limit + 1);
        PageCursor position = cursor;
        int scanned = 0;
        while (admitted.size() <= limit) {
            List<T> rows = fetchWindow(spec, position, window);
            scanned += rows.size();
            for (T row : GraphAccessEvaluator.filterByPermission(rows, accessibleAclIds)) {
                if (admitted.size() > limit) {
                    break;
                }
                admitted.add(row);
            }
            if (rows.size() < window) {
                break;
            }
            position = PageCursor.after(rows.get(rows.size() - 1));
        }
        logger.debug("Scanned {} {} rows to admit {}", scanned, lowerName(), admitted.size());
        return admitted;
    }

    private List<T> fetchWindow(Specification<T> spec, PageCursor cursor, int size) {
        Specification<T> windowSpec = cursor == null ? spec : spec.and(after(cursor));
        return repository.findAll(windowSpec, PageRequest.of(0, size, NEWEST_FIRST)).getContent();
    }

    private Outcome<T> append(T current, UUID actorId, Consumer<T> change) {
        if (repository.supersede(current.getId()) != 1) {
            logger.warn("{} {} was superseded concurrently", resourceName(), current.getId());
            return Outcome.conflict(CONCURRENT_MODIFICATION,
                    resourceName() + " was modified concurrently, reload and retry");
        }
        T next = copyOf(current);
        next.setId(UUID.randomUUID());
        next.setVersion(current.getVersion() + 1);
        next.setPreviousVersionId(current.getId());
        next.setLatest(true);
        next.setDeleted(current.isDeleted());
        next.setAclId(current.getAclId());
        next.setProperties(current.getProperties());
        next.setCreatedAt(now());
        next.setCreatedBy(actorId);
        change.accept(next);
        T saved = repository.save(next);
        logger.info("Appended {} {} v{} superseding {}", lowerName(), saved.getId(), saved.getVersion(),
                current.getId());
        return Outcome.ok(saved);
    }

    private Outcome<T> checkRead(T latest, UUID callerId) {
        if (access.hasPermission(latest.getAclId(), callerId, AclPermission.READ)) {
            return null;
        }
        logger.warn("Read of {} {} denied to {}", lowerName(), latest.getId(), callerId);
        if (callerId == null) {
            return Outcome.forbidden("Authentication required to view this " + lowerName());
        }
        return Outcome.forbidden("You do not have permission to view this " + lowerName());
    }

    private Outcome<T> checkWrite(T latest, UUID callerId, String action) {
        if (callerId != null && access.hasPermission(latest.getAclId(), callerId, AclPermission.WRITE)) {
            return null;
        }
        logger.warn("{} of {} {} denied to {}", action, lowerName(), latest.getId(), callerId);
        if (callerId == null) {
            return Outcome.forbidden("Authentication required to " + action + " this " + lowerName());
        }
        return Outcome.forbidden("You do not have permission to " + action + " this " + lowerName());
    }

    /** Millisecond precision so that cursors taken from rows match the stored values. */
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private String lowerName() {
        return resourceName().toLowerCase();
    }

    private Specification<T> latestOnly() {
        return (root, query, cb) -> cb.isTrue(root.get("latest"));
    }

    private Specification<T> notDeleted() {
        return (root, query, cb) -> cb.isFalse(root.get("deleted"));
    }

    private Specification<T> after(PageCursor cursor) {
        return (root, query, cb) -> cb.or(
                cb.lessThan(root.<Instant>get("createdAt"), cursor.getCreatedAt()),
                cb.and(cb.equal(root.get("createdAt"), cursor.getCreatedAt()),
                        cb.lessThan(root.<UUID>get("id"), cursor.getId())));
    }

    private Specification<T> aclIn(Set<Long> aclIds) {
        return (root, query, cb) -> {
            if (aclIds.isEmpty()) {
                return cb.isNull(root.get("aclId"));
            }
            return cb.or(cb.isNull(root.get("aclId")), root.get("aclId").in(aclIds));
        };
    }
}
