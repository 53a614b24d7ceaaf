package com.example.organizationservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Building organizations are located in.
 * Organizations restrict deletion of their building (FK ON DELETE RESTRICT).
 */
@Entity
@Table(name = "buildings")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Building {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "address", nullable = false)
    private String address;

    @Embedded
    private Coordinate coordinate;
}
