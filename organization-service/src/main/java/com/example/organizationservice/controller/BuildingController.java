package com.example.organizationservice.controller;

import com.example.organizationservice.dto.request.BuildingFilterRequest;
import com.example.organizationservice.dto.request.CreateBuildingRequest;
import com.example.organizationservice.dto.request.PaginationRequest;
import com.example.organizationservice.dto.request.PatchBuildingRequest;
import com.example.organizationservice.dto.request.UpdateBuildingRequest;
import com.example.organizationservice.dto.response.BuildingResponse;
import com.example.organizationservice.dto.response.PageResponse;
import com.example.organizationservice.service.BuildingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST Controller for building operations. API token required.
 */
@RestController
@RequestMapping("/api/v1/buildings")
@RequiredArgsConstructor
public class BuildingController {

    private final BuildingService buildingService;

    @PostMapping
    public ResponseEntity<BuildingResponse> createBuilding(
            @Valid @RequestBody CreateBuildingRequest request) {

        BuildingResponse response = buildingService.createBuilding(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<PageResponse<BuildingResponse>> listBuildings(
            @ModelAttribute BuildingFilterRequest filter,
            @Valid @ModelAttribute PaginationRequest pagination) {

        return ResponseEntity.ok(buildingService.listBuildings(filter, pagination));
    }

    @GetMapping("/{buildingId}")
    public ResponseEntity<BuildingResponse> getBuildingById(@PathVariable UUID buildingId) {
        return ResponseEntity.ok(buildingService.getBuildingById(buildingId));
    }

    @PutMapping("/{buildingId}")
    public ResponseEntity<BuildingResponse> updateBuilding(
            @PathVariable UUID buildingId,
            @Valid @RequestBody UpdateBuildingRequest request) {

        return ResponseEntity.ok(buildingService.updateBuilding(buildingId, request));
    }

    @PatchMapping("/{buildingId}")
    public ResponseEntity<BuildingResponse> patchBuilding(
            @PathVariable UUID buildingId,
            @Valid @RequestBody PatchBuildingRequest request) {

        return ResponseEntity.ok(buildingService.patchBuilding(buildingId, request));
    }

    @DeleteMapping("/{buildingId}")
    public ResponseEntity<Void> deleteBuilding(@PathVariable UUID buildingId) {
        buildingService.deleteBuilding(buildingId);
        return ResponseEntity.noContent().build();
    }
}
