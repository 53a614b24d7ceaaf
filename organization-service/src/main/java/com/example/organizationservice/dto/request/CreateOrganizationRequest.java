package com.example.organizationservice.dto.request;

import com.example.organizationservice.entity.Organization;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Request DTO for creating an organization.
 * Phone numbers must match +XXXXXXXXXX (6 to 15 digits).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrganizationRequest {

    @NotBlank(message = "Name is required")
    @Size(max = Organization.NAME_MAX_LENGTH, message = "Name must be at most 255 characters")
    private String name;

    @Builder.Default
    private List<String> phoneNumbers = new ArrayList<>();

    @NotNull(message = "Building ID is required")
    private UUID buildingId;

    @Builder.Default
    private List<UUID> activityIds = new ArrayList<>();
}
