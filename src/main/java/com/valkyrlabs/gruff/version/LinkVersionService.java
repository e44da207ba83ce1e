package com.valkyrlabs.gruff.version;

import java.time.Clock;

import org.springframework.stereotype.Service;

import com.valkyrlabs.api.GraphLinkRepository;
import com.valkyrlabs.gruff.acl.CanonicalAclStore;
import com.valkyrlabs.gruff.config.GruffProperties;
import com.valkyrlabs.gruff.error.Outcome;
import com.valkyrlabs.gruff.security.GraphAccessEvaluator;
import com.valkyrlabs.model.GraphEntity;
import com.valkyrlabs.model.GraphLink;

/**
 * Version chains of links. A link may only be created between two entities that
 * exist and are not deleted; the endpoints are stored as the entities' latest ids
 * at creation time.
 */
@Service
public class LinkVersionService extends VersionChainService<GraphLink> {

    private final EntityVersionService entities;

    public LinkVersionService(GraphLinkRepository repository, CanonicalAclStore aclStore,
            GraphAccessEvaluator access, GruffProperties properties, Clock clock, EntityVersionService entities) {
        super(repository, aclStore, access, properties, clock);
        this.entities = entities;
    }

    @Override
    protected Outcome<GraphLink> checkDraft(GraphLink draft) {
        GraphEntity source = draft.getSourceEntityId() == null ? null : entities.findLatest(draft.getSourceEntityId());
        if (source == null || source.isDeleted()) {
            return Outcome.notFound("Source entity");
        }
        GraphEntity target = draft.getTargetEntityId() == null ? null : entities.findLatest(draft.getTargetEntityId());
        if (target == null || target.isDeleted()) {
            return Outcome.notFound("Target entity");
        }
        draft.setSourceEntityId(source.getId());
        draft.setTargetEntityId(target.getId());
        return Outcome.ok(draft);
    }

    @Override
    protected GraphLink copyOf(GraphLink source) {
        return new GraphLink(source.getTypeId(), source.getSourceEntityId(), source.getTargetEntityId());
    }

    @Override
    protected String resourceName() {
        return "Link";
    }
}
