package com.example.organizationservice.service.impl;

import com.example.organizationservice.dto.request.BuildingFilterRequest;
import com.example.organizationservice.dto.request.CreateBuildingRequest;
import com.example.organizationservice.dto.request.PaginationRequest;
import com.example.organizationservice.dto.request.PatchBuildingRequest;
import com.example.organizationservice.dto.request.UpdateBuildingRequest;
import com.example.organizationservice.dto.response.BuildingResponse;
import com.example.organizationservice.dto.response.PageResponse;
import com.example.organizationservice.entity.Building;
import com.example.organizationservice.entity.Coordinate;
import com.example.organizationservice.exception.BadRequestException;
import com.example.organizationservice.exception.ResourceNotFoundException;
import com.example.organizationservice.pagination.Page;
import com.example.organizationservice.repository.BuildingQueryRepository;
import com.example.organizationservice.repository.BuildingRepository;
import com.example.organizationservice.service.BuildingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class BuildingServiceImpl implements BuildingService {

    private final BuildingRepository buildingRepository;
    private final BuildingQueryRepository buildingQueryRepository;

    @Override
    @Transactional
    public BuildingResponse createBuilding(CreateBuildingRequest request) {
        log.info("Creating building: address={}", request.getAddress());

        Building building = Building.builder()
                .address(request.getAddress())
                .coordinate(toCoordinate(request.getLatitude(), request.getLongitude()))
                .build();

        Building saved = buildingRepository.saveAndFlush(building);
        log.info("Building created successfully: buildingId={}", saved.getId());

        return BuildingResponse.from(saved);
    }

    @Override
    public BuildingResponse getBuildingById(UUID buildingId) {
        log.info("Getting building: buildingId={}", buildingId);
        return BuildingResponse.from(findBuilding(buildingId));
    }

    @Override
    public PageResponse<BuildingResponse> listBuildings(BuildingFilterRequest filter, PaginationRequest pagination) {
        log.info("Listing buildings: filter={}, page={}, perPage={}",
                filter, pagination.getPage(), pagination.getPerPage());

        Page<Building> page = buildingQueryRepository.getPage(
                filter.toSpecifications(),
                List.of(),
                filter.toSorts(),
                pagination.toPaginationInfo());

        return PageResponse.from(page, BuildingResponse::from);
    }

    @Override
    @Transactional
    public BuildingResponse updateBuilding(UUID buildingId, UpdateBuildingRequest request) {
        log.info("Updating building: buildingId={}", buildingId);

        Building building = findBuilding(buildingId);
        building.setAddress(request.getAddress());
        building.setCoordinate(toCoordinate(request.getLatitude(), request.getLongitude()));

        Building saved = buildingRepository.saveAndFlush(building);
        log.info("Building updated successfully: buildingId={}", buildingId);

        return BuildingResponse.from(saved);
    }

    @Override
    @Transactional
    public BuildingResponse patchBuilding(UUID buildingId, PatchBuildingRequest request) {
        log.info("Patching building: buildingId={}", buildingId);

        Building building = findBuilding(buildingId);
        if (request.getAddress() != null) {
            building.setAddress(request.getAddress());
        }
        if (request.getLatitude() != null || request.getLongitude() != null) {
            Coordinate current = building.getCoordinate();
            double latitude = request.getLatitude() != null ? request.getLatitude() : current.getLatitude();
            double longitude = request.getLongitude() != null ? request.getLongitude() : current.getLongitude();
            building.setCoordinate(toCoordinate(latitude, longitude));
        }

        Building saved = buildingRepository.saveAndFlush(building);
        log.info("Building patched successfully: buildingId={}", buildingId);

        return BuildingResponse.from(saved);
    }

    @Override
    @Transactional
    public void deleteBuilding(UUID buildingId) {
        log.info("Deleting building: buildingId={}", buildingId);

        findBuilding(buildingId);
        buildingRepository.deleteById(buildingId);
        // surface ON DELETE RESTRICT violations here rather than at commit
        buildingRepository.flush();

        log.info("Building deleted successfully: buildingId={}", buildingId);
    }

    private Building findBuilding(UUID buildingId) {
        return buildingRepository.findById(buildingId)
                .orElseThrow(() -> ResourceNotFoundException.buildingNotFound(buildingId));
    }

    private static Coordinate toCoordinate(double latitude, double longitude) {
        try {
            return new Coordinate(latitude, longitude);
        } catch (IllegalArgumentException e) {
            throw BadRequestException.invalidCoordinate(e);
        }
    }
}
