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
 * Full replacement of an activity's mutable fields. A null parentId moves the
 * activity to the root level.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateActivityRequest {

    @NotBlank(message = "Name is required")
    @Size(max = Activity.NAME_MAX_LENGTH, message = "Name must be at most 128 characters")
    private String name;

    private UUID parentId;
}
