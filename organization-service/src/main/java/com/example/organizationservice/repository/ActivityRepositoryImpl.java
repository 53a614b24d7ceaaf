package com.example.organizationservice.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Recursive CTE over activities.parent_id.
 * UNION (not UNION ALL) keeps the walk finite even if the data holds a cycle.
 */
@Repository
@Slf4j
public class ActivityRepositoryImpl implements ActivityRepositoryCustom {

    private static final String SELF_AND_DESCENDANTS_SQL = """
            WITH RECURSIVE tree(id) AS (
                SELECT a.id FROM activities a WHERE a.id IN (:ids)
                UNION
                SELECT c.id FROM activities c JOIN tree t ON c.parent_id = t.id
            )
            SELECT id FROM tree
            """;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @SuppressWarnings("unchecked")
    public List<UUID> findSelfAndDescendantIds(Collection<UUID> activityIds) {
        if (activityIds == null || activityIds.isEmpty()) {
            return List.of();
        }
        List<UUID> ids = entityManager.createNativeQuery(SELF_AND_DESCENDANTS_SQL, UUID.class)
                .setParameter("ids", activityIds)
                .getResultList();
        log.debug("Resolved {} activities with descendants from {} roots", ids.size(), activityIds.size());
        return ids;
    }
}
