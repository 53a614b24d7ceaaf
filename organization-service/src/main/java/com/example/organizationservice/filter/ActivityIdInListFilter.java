package com.example.organizationservice.filter;

import com.example.organizationservice.entity.Organization;
import com.example.organizationservice.entity.OrganizationActivity;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Keeps organizations tagged with at least one of the given activities.
 * Uses a subquery on the association table so each organization appears once.
 */
public class ActivityIdInListFilter implements QueryFilter<Organization> {

    private final List<UUID> activityIds;

    public ActivityIdInListFilter(Collection<UUID> activityIds) {
        this.activityIds = List.copyOf(activityIds);
    }

    public List<UUID> getActivityIds() {
        return activityIds;
    }

    @Override
    public Predicate toPredicate(Root<Organization> root, CriteriaQuery<?> query, CriteriaBuilder cb) {
        if (activityIds.isEmpty()) {
            return cb.disjunction();
        }
        Subquery<UUID> tagged = query.subquery(UUID.class);
        Root<OrganizationActivity> link = tagged.from(OrganizationActivity.class);
        tagged.select(link.get("organizationId"))
                .where(link.get("activityId").in(activityIds));
        return root.get("id").in(tagged);
    }
}
