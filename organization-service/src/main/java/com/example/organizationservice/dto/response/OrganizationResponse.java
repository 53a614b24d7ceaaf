package com.example.organizationservice.dto.response;

import com.example.organizationservice.entity.Organization;
import com.example.organizationservice.entity.PhoneNumber;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Response DTO for organizations, including the ids of their activities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationResponse {

    private UUID id;
    private String name;
    private List<String> phoneNumbers;
    private UUID buildingId;
    private List<UUID> activityIds;

    public static OrganizationResponse from(Organization organization) {
        return OrganizationResponse.builder()
                .id(organization.getId())
                .name(organization.getName())
                .phoneNumbers(organization.getPhoneNumbers().stream().map(PhoneNumber::getValue).toList())
                .buildingId(organization.getBuildingId())
                .activityIds(List.copyOf(organization.getActivityIds()))
                .build();
    }
}
