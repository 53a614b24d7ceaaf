package com.example.organizationservice.dto.request;

import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update: null fields are left untouched. A single coordinate
 * component may be changed on its own.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatchBuildingRequest {

    @Pattern(regexp = ".*\\S.*", message = "Address must not be blank")
    private String address;

    private Double latitude;

    private Double longitude;
}
