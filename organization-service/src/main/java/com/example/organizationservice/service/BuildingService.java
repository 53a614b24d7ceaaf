package com.example.organizationservice.service;

import com.example.organizationservice.dto.request.BuildingFilterRequest;
import com.example.organizationservice.dto.request.CreateBuildingRequest;
import com.example.organizationservice.dto.request.PaginationRequest;
import com.example.organizationservice.dto.request.PatchBuildingRequest;
import com.example.organizationservice.dto.request.UpdateBuildingRequest;
import com.example.organizationservice.dto.response.BuildingResponse;
import com.example.organizationservice.dto.response.PageResponse;

import java.util.UUID;

/**
 * Service interface for building operations.
 */
public interface BuildingService {

    BuildingResponse createBuilding(CreateBuildingRequest request);

    BuildingResponse getBuildingById(UUID buildingId);

    PageResponse<BuildingResponse> listBuildings(BuildingFilterRequest filter, PaginationRequest pagination);

    BuildingResponse updateBuilding(UUID buildingId, UpdateBuildingRequest request);

    BuildingResponse patchBuilding(UUID buildingId, PatchBuildingRequest request);

    /**
     * Delete a building. Fails with a data integrity violation while
     * organizations are still located in it.
     */
    void deleteBuilding(UUID buildingId);
}
