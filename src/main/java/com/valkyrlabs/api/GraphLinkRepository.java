package com.valkyrlabs.api;

import com.valkyrlabs.model.GraphLink;

public interface GraphLinkRepository extends VersionedResourceRepository<GraphLink> {
}
