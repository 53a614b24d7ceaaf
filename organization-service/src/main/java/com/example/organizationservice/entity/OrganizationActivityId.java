package com.example.organizationservice.entity;

import lombok.*;

import java.io.Serializable;
import java.util.UUID;

/**
 * Composite primary key for OrganizationActivity.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class OrganizationActivityId implements Serializable {

    private UUID organizationId;

    private UUID activityId;
}
