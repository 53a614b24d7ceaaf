package com.example.organizationservice.repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Tree queries the JPA Criteria API cannot express.
 */
public interface ActivityRepositoryCustom {

    /**
     * The given ids plus every transitive descendant, in one recursive query.
     * Ids that do not exist are not returned.
     */
    List<UUID> findSelfAndDescendantIds(Collection<UUID> activityIds);
}
