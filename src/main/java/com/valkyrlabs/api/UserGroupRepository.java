package com.valkyrlabs.api;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.repository.CrudRepository;

import com.valkyrlabs.model.UserGroup;

public interface UserGroupRepository extends CrudRepository<UserGroup, UUID> {

        Optional<UserGroup> findByName(String name);

        boolean existsByName(String name);
}
