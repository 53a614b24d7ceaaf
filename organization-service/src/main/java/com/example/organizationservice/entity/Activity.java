package com.example.organizationservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Node of the activity taxonomy. Activities form a forest through
 * {@code parentId}; a node's depth (the node itself counting as 1) never
 * exceeds {@link #MAX_NESTING_LEVEL}.
 *
 * Deleting an activity cascades to its descendants and to organization
 * associations at the database level.
 */
@Entity
@Table(name = "activities")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Activity {

    public static final int MAX_NESTING_LEVEL = 3;

    public static final int NAME_MAX_LENGTH = 128;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "parent_id")
    private UUID parentId;

    @Column(name = "name", nullable = false, length = NAME_MAX_LENGTH)
    private String name;
}
