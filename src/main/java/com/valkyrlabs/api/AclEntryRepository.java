package com.valkyrlabs.api;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;

import com.valkyrlabs.model.AclEntry;
import com.valkyrlabs.model.AclPermission;
import com.valkyrlabs.model.PrincipalType;

/**
 * Custom queries to support our ACL lookup scheme
 */
public interface AclEntryRepository extends CrudRepository<AclEntry, Long> {

        /**
         * Entries of one ACL in canonical order.
         */
        List<AclEntry> findByAclIdOrderByPrincipalTypeAscPrincipalIdAscPermissionAsc(Long aclId);

        /**
         * Distinct ACL ids granting any of {@code permissions} to any of the given
         * principals of one type.
         *
         * @param principalType user or group
         * @param principalIds  ids of that type, must not be empty
         * @param permissions   permissions that satisfy the check being made
         * @return list of matching ACL ids
         */
        @Query("select distinct e.aclId from AclEntry e "
                        + "where e.principalType = :principalType "
                        + "and e.principalId in :principalIds "
                        + "and e.permission in :permissions")
        List<Long> findAclIdsGranting(@Param("principalType") PrincipalType principalType,
                        @Param("principalIds") Collection<UUID> principalIds,
                        @Param("permissions") Collection<AclPermission> permissions);
}
