package com.example.organizationservice.repository;

import com.example.organizationservice.entity.OrganizationActivity;
import com.example.organizationservice.entity.OrganizationActivityId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for organization-activity association rows.
 */
@Repository
public interface OrganizationActivityRepository
        extends JpaRepository<OrganizationActivity, OrganizationActivityId>, OrganizationActivityRepositoryCustom {

    /**
     * Associations of several organizations at once, for attaching activityIds to a page.
     */
    List<OrganizationActivity> findAllByOrganizationIdIn(Collection<UUID> organizationIds);

    List<OrganizationActivity> findAllByOrganizationId(UUID organizationId);

    /**
     * Remove every association of an organization.
     * Clears the persistence context so re-inserting the same pairs does not collide.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM OrganizationActivity oa WHERE oa.organizationId = :organizationId")
    int deleteAllByOrganizationId(@Param("organizationId") UUID organizationId);
}
