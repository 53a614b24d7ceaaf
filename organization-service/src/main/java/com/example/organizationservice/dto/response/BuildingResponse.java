package com.example.organizationservice.dto.response;

import com.example.organizationservice.entity.Building;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildingResponse {

    private UUID id;
    private String address;
    private double latitude;
    private double longitude;

    public static BuildingResponse from(Building building) {
        return BuildingResponse.builder()
                .id(building.getId())
                .address(building.getAddress())
                .latitude(building.getCoordinate().getLatitude())
                .longitude(building.getCoordinate().getLongitude())
                .build();
    }
}
