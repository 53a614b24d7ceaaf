package com.example.organizationservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Organization located in a building and tagged with activities.
 *
 * activityIds is not mapped: the associations live in organization_activities
 * and are attached by the service after loading.
 */
@Entity
@Table(name = "organizations")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Organization {

    public static final int NAME_MAX_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Convert(converter = PhoneNumberListConverter.class)
    @Column(name = "phone_numbers", nullable = false)
    @Builder.Default
    private List<PhoneNumber> phoneNumbers = new ArrayList<>();

    @Column(name = "building_id", nullable = false)
    private UUID buildingId;

    @Transient
    @Builder.Default
    private List<UUID> activityIds = new ArrayList<>();
}
