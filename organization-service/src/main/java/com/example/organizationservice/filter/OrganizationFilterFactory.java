package com.example.organizationservice.filter;

import com.example.organizationservice.exception.BadRequestException;
import com.example.organizationservice.service.ActivityHierarchyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Builds organization filters that need a database lookup before the main
 * query, such as expanding activity ids to their descendants.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrganizationFilterFactory {

    private final ActivityHierarchyService activityHierarchyService;

    public ActivityIdInListFilter activityIds(Collection<UUID> activityIds) {
        return new ActivityIdInListFilter(activityIds);
    }

    public ActivityIdInListFilter activityIdsWithChildren(Collection<UUID> activityIds) {
        if (activityIds.isEmpty()) {
            return new ActivityIdInListFilter(List.of());
        }
        List<UUID> expanded = activityHierarchyService.findSelfAndDescendantIds(activityIds);
        log.debug("Expanded activity filter: requested={}, withDescendants={}", activityIds.size(), expanded.size());
        return new ActivityIdInListFilter(expanded);
    }

    public CoordinateFilter coordinates(String boundingBox) {
        try {
            return CoordinateFilter.parse(boundingBox);
        } catch (IllegalArgumentException e) {
            throw BadRequestException.invalidBoundingBox(e);
        }
    }
}
