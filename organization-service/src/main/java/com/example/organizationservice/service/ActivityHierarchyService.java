package com.example.organizationservice.service;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Rules of the activity tree.
 */
public interface ActivityHierarchyService {

    /**
     * Verify that a child may be attached under the given parent without
     * exceeding {@code Activity.MAX_NESTING_LEVEL}.
     *
     * @param parentId existing activity the child is attached to
     * @throws com.example.organizationservice.exception.ConflictException ACTIVITY_MAXIMUM_NESTING
     */
    void validateNesting(UUID parentId);

    /**
     * Verify that moving {@code activityId} under {@code parentId} keeps the tree acyclic.
     *
     * @throws com.example.organizationservice.exception.ConflictException ACTIVITY_HIERARCHY_CYCLE
     */
    void validateNoCycle(UUID activityId, UUID parentId);

    /**
     * The given ids plus every transitive descendant.
     */
    List<UUID> findSelfAndDescendantIds(Collection<UUID> activityIds);
}
