package com.example.organizationservice.dto.request;

import com.example.organizationservice.entity.Activity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Request DTO for creating an activity. A null parentId creates a root.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateActivityRequest {

    @NotBlank(message = "Name is required")
    @Size(max = Activity.NAME_MAX_LENGTH, message = "Name must be at most 128 characters")
    private String name;

    private UUID parentId;
}
