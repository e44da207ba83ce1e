package com.valkyrlabs.api;

import java.util.Optional;

import org.springframework.data.repository.CrudRepository;

import com.valkyrlabs.model.Acl;

public interface AclRepository extends CrudRepository<Acl, Long> {

        Optional<Acl> findByHash(String hash);
}
