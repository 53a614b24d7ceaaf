package com.example.organizationservice.repository;

import java.util.Collection;
import java.util.UUID;

/**
 * Bulk insert of organization-activity associations.
 */
public interface OrganizationActivityRepositoryCustom {

    /**
     * Insert one association row per activity id with a multi-row INSERT.
     *
     * @return number of rows inserted
     */
    int insertAll(UUID organizationId, Collection<UUID> activityIds);
}
