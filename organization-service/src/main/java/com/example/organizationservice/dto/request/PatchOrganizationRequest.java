package com.example.organizationservice.dto.request;

import com.example.organizationservice.entity.Organization;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Partial update: null fields are left untouched. A present activityIds list
 * (even an empty one) replaces the whole activity set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatchOrganizationRequest {

    @Size(min = 1, max = Organization.NAME_MAX_LENGTH, message = "Name must be between 1 and 255 characters")
    @Pattern(regexp = ".*\\S.*", message = "Name must not be blank")
    private String name;

    private List<String> phoneNumbers;

    private UUID buildingId;

    private List<UUID> activityIds;
}
