package com.example.organizationservice.controller;

import com.example.organizationservice.dto.request.CreateOrganizationRequest;
import com.example.organizationservice.dto.request.OrganizationFilterRequest;
import com.example.organizationservice.dto.request.PaginationRequest;
import com.example.organizationservice.dto.request.PatchOrganizationRequest;
import com.example.organizationservice.dto.request.UpdateOrganizationRequest;
import com.example.organizationservice.dto.response.OrganizationResponse;
import com.example.organizationservice.dto.response.PageResponse;
import com.example.organizationservice.service.OrganizationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST Controller for organization operations.
 *
 * Authorization: public. Unlike activities and buildings these endpoints
 * are not behind the API token.
 *
 * Filters (GET /api/v1/organizations):
 * - ids, buildingIds, nameIlike
 * - activityIds: tagged with any of the activities
 * - activityIdsWithChildren: tagged with any of the activities or their descendants
 * - coords: minLat,minLon;maxLat,maxLon
 */
@RestController
@RequestMapping("/api/v1/organizations")
@RequiredArgsConstructor
public class OrganizationController {

    private final OrganizationService organizationService;

    @PostMapping
    public ResponseEntity<OrganizationResponse> createOrganization(
            @Valid @RequestBody CreateOrganizationRequest request) {

        OrganizationResponse response = organizationService.createOrganization(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<PageResponse<OrganizationResponse>> listOrganizations(
            @ModelAttribute OrganizationFilterRequest filter,
            @Valid @ModelAttribute PaginationRequest pagination) {

        return ResponseEntity.ok(organizationService.listOrganizations(filter, pagination));
    }

    @GetMapping("/{organizationId}")
    public ResponseEntity<OrganizationResponse> getOrganizationById(@PathVariable UUID organizationId) {
        return ResponseEntity.ok(organizationService.getOrganizationById(organizationId));
    }

    @PutMapping("/{organizationId}")
    public ResponseEntity<OrganizationResponse> updateOrganization(
            @PathVariable UUID organizationId,
            @Valid @RequestBody UpdateOrganizationRequest request) {

        return ResponseEntity.ok(organizationService.updateOrganization(organizationId, request));
    }

    @PatchMapping("/{organizationId}")
    public ResponseEntity<OrganizationResponse> patchOrganization(
            @PathVariable UUID organizationId,
            @Valid @RequestBody PatchOrganizationRequest request) {

        return ResponseEntity.ok(organizationService.patchOrganization(organizationId, request));
    }

    @DeleteMapping("/{organizationId}")
    public ResponseEntity<Void> deleteOrganization(@PathVariable UUID organizationId) {
        organizationService.deleteOrganization(organizationId);
        return ResponseEntity.noContent().build();
    }
}
