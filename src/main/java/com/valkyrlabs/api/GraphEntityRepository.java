package com.valkyrlabs.api;

import com.valkyrlabs.model.GraphEntity;

public interface GraphEntityRepository extends VersionedResourceRepository<GraphEntity> {
}
