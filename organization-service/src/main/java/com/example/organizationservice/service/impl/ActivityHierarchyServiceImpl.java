package com.example.organizationservice.service.impl;

import com.example.organizationservice.entity.Activity;
import com.example.organizationservice.exception.ConflictException;
import com.example.organizationservice.exception.ResourceNotFoundException;
import com.example.organizationservice.repository.ActivityRepository;
import com.example.organizationservice.service.ActivityHierarchyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Walks the activity tree through parent links.
 * Both walks are bounded by MAX_NESTING_LEVEL, so corrupt data with a
 * cycle cannot make them loop forever.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class ActivityHierarchyServiceImpl implements ActivityHierarchyService {

    private final ActivityRepository activityRepository;

    @Override
    public void validateNesting(UUID parentId) {
        int depth = 1;
        Activity current = loadActivity(parentId);
        while (current.getParentId() != null) {
            depth++;
            if (depth >= Activity.MAX_NESTING_LEVEL) {
                log.warn("Nesting limit reached: parentId={}, maxNestingLevel={}",
                        parentId, Activity.MAX_NESTING_LEVEL);
                throw ConflictException.activityMaximumNesting(parentId, Activity.MAX_NESTING_LEVEL);
            }
            current = loadActivity(current.getParentId());
        }
    }

    @Override
    public void validateNoCycle(UUID activityId, UUID parentId) {
        UUID ancestorId = parentId;
        int steps = 0;
        while (ancestorId != null && steps <= Activity.MAX_NESTING_LEVEL) {
            if (ancestorId.equals(activityId)) {
                throw ConflictException.activityHierarchyCycle(activityId, parentId);
            }
            ancestorId = loadActivity(ancestorId).getParentId();
            steps++;
        }
    }

    @Override
    public List<UUID> findSelfAndDescendantIds(Collection<UUID> activityIds) {
        if (activityIds == null || activityIds.isEmpty()) {
            return List.of();
        }
        return activityRepository.findSelfAndDescendantIds(activityIds);
    }

    private Activity loadActivity(UUID activityId) {
        return activityRepository.findById(activityId)
                .orElseThrow(() -> ResourceNotFoundException.activityNotFound(activityId));
    }
}
