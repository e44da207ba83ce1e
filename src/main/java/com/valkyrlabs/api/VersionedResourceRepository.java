package com.valkyrlabs.api;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import com.valkyrlabs.model.VersionedResource;

/**
 * Queries shared by every version-chained resource table.
 *
 * @param <T> the resource kind
 */
@NoRepositoryBean
public interface VersionedResourceRepository<T extends VersionedResource>
                extends JpaRepository<T, UUID>, JpaSpecificationExecutor<T> {

        Optional<T> findByIdAndLatestTrue(UUID id);

        /**
         * Rows that name {@code previousVersionId} as their predecessor. A consistent
         * chain has at most one.
         */
        List<T> findByPreviousVersionId(UUID previousVersionId);

        /**
         * Conditionally clears the latest flag. Returns 0 when another writer already
         * superseded the row, which is how concurrent appends to one chain are detected.
         */
        @Modifying(flushAutomatically = true, clearAutomatically = true)
        @Query("update #{#entityName} r set r.latest = false where r.id = :id and r.latest = true")
        int supersede(@Param("id") UUID id);
}
