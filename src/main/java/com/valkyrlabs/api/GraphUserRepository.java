package com.valkyrlabs.api;

import java.util.UUID;

import org.springframework.data.repository.CrudRepository;

import com.valkyrlabs.model.GraphUser;

/**
 * Identity lookups. This core never writes users outside of tests.
 */
public interface GraphUserRepository extends CrudRepository<GraphUser, UUID> {
}
