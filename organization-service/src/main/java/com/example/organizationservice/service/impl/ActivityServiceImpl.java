package com.example.organizationservice.service.impl;

import com.example.organizationservice.dto.request.ActivityFilterRequest;
import com.example.organizationservice.dto.request.CreateActivityRequest;
import com.example.organizationservice.dto.request.PaginationRequest;
import com.example.organizationservice.dto.request.PatchActivityRequest;
import com.example.organizationservice.dto.request.UpdateActivityRequest;
import com.example.organizationservice.dto.response.ActivityResponse;
import com.example.organizationservice.dto.response.PageResponse;
import com.example.organizationservice.entity.Activity;
import com.example.organizationservice.exception.ResourceNotFoundException;
import com.example.organizationservice.pagination.Page;
import com.example.organizationservice.repository.ActivityQueryRepository;
import com.example.organizationservice.repository.ActivityRepository;
import com.example.organizationservice.service.ActivityHierarchyService;
import com.example.organizationservice.service.ActivityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Implementation of ActivityService.
 * Parent changes go through ActivityHierarchyService.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class ActivityServiceImpl implements ActivityService {

    private final ActivityRepository activityRepository;
    private final ActivityQueryRepository activityQueryRepository;
    private final ActivityHierarchyService activityHierarchyService;

    @Override
    @Transactional
    public ActivityResponse createActivity(CreateActivityRequest request) {
        log.info("Creating activity: name={}, parentId={}", request.getName(), request.getParentId());

        if (request.getParentId() != null) {
            ensureParentExists(request.getParentId());
            activityHierarchyService.validateNesting(request.getParentId());
        }

        Activity activity = Activity.builder()
                .name(request.getName())
                .parentId(request.getParentId())
                .build();

        Activity saved = activityRepository.saveAndFlush(activity);
        log.info("Activity created successfully: activityId={}", saved.getId());

        return ActivityResponse.from(saved);
    }

    @Override
    public ActivityResponse getActivityById(UUID activityId) {
        log.info("Getting activity: activityId={}", activityId);
        return ActivityResponse.from(findActivity(activityId));
    }

    @Override
    public PageResponse<ActivityResponse> listActivities(ActivityFilterRequest filter, PaginationRequest pagination) {
        log.info("Listing activities: filter={}, page={}, perPage={}",
                filter, pagination.getPage(), pagination.getPerPage());

        Page<Activity> page = activityQueryRepository.getPage(
                filter.toSpecifications(),
                List.of(),
                filter.toSorts(),
                pagination.toPaginationInfo());

        return PageResponse.from(page, ActivityResponse::from);
    }

    @Override
    @Transactional
    public ActivityResponse updateActivity(UUID activityId, UpdateActivityRequest request) {
        log.info("Updating activity: activityId={}, parentId={}", activityId, request.getParentId());

        Activity activity = findActivity(activityId);
        if (request.getParentId() != null) {
            validateNewParent(activityId, request.getParentId());
        }

        activity.setName(request.getName());
        activity.setParentId(request.getParentId());

        Activity saved = activityRepository.saveAndFlush(activity);
        log.info("Activity updated successfully: activityId={}", activityId);

        return ActivityResponse.from(saved);
    }

    @Override
    @Transactional
    public ActivityResponse patchActivity(UUID activityId, PatchActivityRequest request) {
        log.info("Patching activity: activityId={}", activityId);

        Activity activity = findActivity(activityId);
        if (request.getName() != null) {
            activity.setName(request.getName());
        }
        if (request.getParentId() != null) {
            validateNewParent(activityId, request.getParentId());
            activity.setParentId(request.getParentId());
        }

        Activity saved = activityRepository.saveAndFlush(activity);
        log.info("Activity patched successfully: activityId={}", activityId);

        return ActivityResponse.from(saved);
    }

    @Override
    @Transactional
    public void deleteActivity(UUID activityId) {
        log.info("Deleting activity: activityId={}", activityId);

        findActivity(activityId);
        activityRepository.deleteById(activityId);

        log.info("Activity deleted successfully: activityId={}", activityId);
    }

    private void validateNewParent(UUID activityId, UUID parentId) {
        ensureParentExists(parentId);
        activityHierarchyService.validateNoCycle(activityId, parentId);
        activityHierarchyService.validateNesting(parentId);
    }

    private void ensureParentExists(UUID parentId) {
        if (!activityRepository.existsById(parentId)) {
            throw ResourceNotFoundException.activityNotFound(parentId);
        }
    }

    private Activity findActivity(UUID activityId) {
        return activityRepository.findById(activityId)
                .orElseThrow(() -> ResourceNotFoundException.activityNotFound(activityId));
    }
}
