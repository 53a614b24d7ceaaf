package com.example.organizationservice.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Multi-row INSERT for association rows, batched to keep statements bounded.
 */
@Repository
@Slf4j
public class OrganizationActivityRepositoryImpl implements OrganizationActivityRepositoryCustom {

    private static final int BATCH_SIZE = 500;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public int insertAll(UUID organizationId, Collection<UUID> activityIds) {
        if (activityIds == null || activityIds.isEmpty()) {
            return 0;
        }

        List<UUID> ids = new ArrayList<>(activityIds);
        int inserted = 0;
        for (int start = 0; start < ids.size(); start += BATCH_SIZE) {
            int end = Math.min(start + BATCH_SIZE, ids.size());
            inserted += executeBatchInsert(organizationId, ids.subList(start, end));
        }

        log.debug("Inserted {} activity associations for organization {}", inserted, organizationId);
        return inserted;
    }

    private int executeBatchInsert(UUID organizationId, List<UUID> batch) {
        StringBuilder sql = new StringBuilder(
                "INSERT INTO organization_activities (organization_id, activity_id) VALUES ");
        for (int i = 0; i < batch.size(); i++) {
            sql.append("(?, ?)");
            if (i < batch.size() - 1) {
                sql.append(", ");
            }
        }

        Query query = entityManager.createNativeQuery(sql.toString());
        int paramIndex = 1;
        for (UUID activityId : batch) {
            query.setParameter(paramIndex++, organizationId);
            query.setParameter(paramIndex++, activityId);
        }
        return query.executeUpdate();
    }
}
