package com.example.organizationservice.controller;

import com.example.organizationservice.dto.request.ActivityFilterRequest;
import com.example.organizationservice.dto.request.CreateActivityRequest;
import com.example.organizationservice.dto.request.PaginationRequest;
import com.example.organizationservice.dto.request.PatchActivityRequest;
import com.example.organizationservice.dto.request.UpdateActivityRequest;
import com.example.organizationservice.dto.response.ActivityResponse;
import com.example.organizationservice.dto.response.PageResponse;
import com.example.organizationservice.service.ActivityService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST Controller for activity operations.
 *
 * Authorization: API token required on every endpoint (see SecurityConfig).
 */
@RestController
@RequestMapping("/api/v1/activities")
@RequiredArgsConstructor
public class ActivityController {

    private final ActivityService activityService;

    @PostMapping
    public ResponseEntity<ActivityResponse> createActivity(
            @Valid @RequestBody CreateActivityRequest request) {

        ActivityResponse response = activityService.createActivity(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<PageResponse<ActivityResponse>> listActivities(
            @ModelAttribute ActivityFilterRequest filter,
            @Valid @ModelAttribute PaginationRequest pagination) {

        return ResponseEntity.ok(activityService.listActivities(filter, pagination));
    }

    @GetMapping("/{activityId}")
    public ResponseEntity<ActivityResponse> getActivityById(@PathVariable UUID activityId) {
        return ResponseEntity.ok(activityService.getActivityById(activityId));
    }

    @PutMapping("/{activityId}")
    public ResponseEntity<ActivityResponse> updateActivity(
            @PathVariable UUID activityId,
            @Valid @RequestBody UpdateActivityRequest request) {

        return ResponseEntity.ok(activityService.updateActivity(activityId, request));
    }

    @PatchMapping("/{activityId}")
    public ResponseEntity<ActivityResponse> patchActivity(
            @PathVariable UUID activityId,
            @Valid @RequestBody PatchActivityRequest request) {

        return ResponseEntity.ok(activityService.patchActivity(activityId, request));
    }

    @DeleteMapping("/{activityId}")
    public ResponseEntity<Void> deleteActivity(@PathVariable UUID activityId) {
        activityService.deleteActivity(activityId);
        return ResponseEntity.noContent().build();
    }
}
