package com.valkyrlabs.gruff.version;

import java.time.Clock;

import org.springframework.stereotype.Service;

import com.valkyrlabs.api.GraphEntityRepository;
import com.valkyrlabs.gruff.acl.CanonicalAclStore;
import com.valkyrlabs.gruff.config.GruffProperties;
import com.valkyrlabs.gruff.security.GraphAccessEvaluator;
import com.valkyrlabs.model.GraphEntity;

@Service
public class EntityVersionService extends VersionChainService<GraphEntity> {

    public EntityVersionService(GraphEntityRepository repository, CanonicalAclStore aclStore,
            GraphAccessEvaluator access, GruffProperties properties, Clock clock) {
        super(repository, aclStore, access, properties, clock);
    }

    @Override
    protected GraphEntity copyOf(GraphEntity source) {
        return new GraphEntity(source.getTypeId());
    }

    @Override
    protected String resourceName() {
        return "Entity";
    }
}
