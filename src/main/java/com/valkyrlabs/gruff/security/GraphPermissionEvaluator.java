package com.valkyrlabs.gruff.security;

import java.io.Serializable;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.PermissionEvaluator;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import com.valkyrlabs.gruff.version.EntityVersionService;
import com.valkyrlabs.gruff.version.LinkVersionService;
import com.valkyrlabs.model.AclPermission;
import com.valkyrlabs.model.AclScoped;
import com.valkyrlabs.model.ResourceKind;
import com.valkyrlabs.model.VersionedResource;

/**
 * Spring Security {@link PermissionEvaluator} backed by {@link GraphAccessEvaluator},
 * for {@code @PreAuthorize("hasPermission(#id, 'entity', 'write')")} style checks.
 *
 * <p>
 * The ACL reference is always re-read from the latest row of the target's chain,
 * never taken from the object passed in, which may be a stale version. Unknown
 * permissions, unknown target types and missing targets deny.
 * </p>
 */
@Component
public class GraphPermissionEvaluator implements PermissionEvaluator {

    protected static final Logger logger = LoggerFactory.getLogger(GraphPermissionEvaluator.class);

    private final GraphAccessEvaluator access;
    private final AuthenticationFacade authenticationFacade;
    private final EntityVersionService entities;
    private final LinkVersionService links;

    public GraphPermissionEvaluator(GraphAccessEvaluator access, AuthenticationFacade authenticationFacade,
            EntityVersionService entities, LinkVersionService links) {
        this.access = access;
        this.authenticationFacade = authenticationFacade;
        this.entities = entities;
        this.links = links;
    }

    @Override
    public boolean hasPermission(Authentication auth, Object targetDomainObject, Object permission) {
        if (targetDomainObject == null || permission == null) {
            logger.warn("Null targetDomainObject or permission - denying access");
            return false;
        }
        if (targetDomainObject instanceof VersionedResource resource) {
            return hasPermission(auth, resource.getId(), resource.getKind().getValue(), permission);
        }
        if (targetDomainObject instanceof AclScoped scoped) {
            return check(auth, scoped.getAclId(), permission);
        }
        logger.warn("Unsupported target {} - denying {}", targetDomainObject.getClass().getSimpleName(), permission);
        return false;
    }

    @Override
    public boolean hasPermission(Authentication auth, Serializable targetId, String targetType, Object permission) {
        if (targetId == null || targetType == null || permission == null) {
            logger.warn("Incomplete permission check id={}, type={}, permission={} - denying", targetId, targetType,
                    permission);
            return false;
        }
        ResourceKind kind = ResourceKind.fromName(targetType);
        if (kind == null) {
            logger.warn("Unknown target type {} - denying {}", targetType, permission);
            return false;
        }
        UUID id;
        try {
            id = targetId instanceof UUID uuid ? uuid : UUID.fromString(targetId.toString());
        } catch (IllegalArgumentException e) {
            logger.warn("Target id {} is not a UUID - denying {}", targetId, permission);
            return false;
        }

        VersionedResource latest = kind == ResourceKind.ENTITY ? entities.findLatest(id) : links.findLatest(id);
        if (latest == null) {
            logger.trace("No {} {} - denying {}", kind, id, permission);
            return false;
        }
        return check(auth, latest.getAclId(), permission);
    }

    private boolean check(Authentication auth, Long aclId, Object permission) {
        AclPermission required = AclPermission.fromString(permission.toString());
        if (required == null) {
            logger.warn("Unknown permission {} - denying", permission);
            return false;
        }
        UUID userId = authenticationFacade.resolveUserId(auth);
        boolean granted = access.hasPermission(aclId, userId, required);
        logger.trace("{} {} on ACL {} -> {}", userId, required, aclId, granted);
        return granted;
    }
}
