package com.example.organizationservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Association row between an organization and one of its activities.
 * Both foreign keys cascade on delete.
 */
@Entity
@Table(name = "organization_activities")
@IdClass(OrganizationActivityId.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationActivity {

    @Id
    @Column(name = "organization_id", nullable = false)
    private UUID organizationId;

    @Id
    @Column(name = "activity_id", nullable = false)
    private UUID activityId;
}
