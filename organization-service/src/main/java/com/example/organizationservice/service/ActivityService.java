package com.example.organizationservice.service;

import com.example.organizationservice.dto.request.ActivityFilterRequest;
import com.example.organizationservice.dto.request.CreateActivityRequest;
import com.example.organizationservice.dto.request.PaginationRequest;
import com.example.organizationservice.dto.request.PatchActivityRequest;
import com.example.organizationservice.dto.request.UpdateActivityRequest;
import com.example.organizationservice.dto.response.ActivityResponse;
import com.example.organizationservice.dto.response.PageResponse;

import java.util.UUID;

/**
 * Service interface for activity operations.
 */
public interface ActivityService {

    /**
     * Create an activity, optionally under an existing parent.
     *
     * @param request Create request
     * @return created activity
     */
    ActivityResponse createActivity(CreateActivityRequest request);

    ActivityResponse getActivityById(UUID activityId);

    /**
     * List activities matching the filter, sorted and paginated.
     */
    PageResponse<ActivityResponse> listActivities(ActivityFilterRequest filter, PaginationRequest pagination);

    /**
     * Replace name and parent of an activity.
     */
    ActivityResponse updateActivity(UUID activityId, UpdateActivityRequest request);

    /**
     * Update only the fields present in the request.
     */
    ActivityResponse patchActivity(UUID activityId, PatchActivityRequest request);

    /**
     * Delete an activity. Descendants and associations are removed by the database.
     */
    void deleteActivity(UUID activityId);
}
