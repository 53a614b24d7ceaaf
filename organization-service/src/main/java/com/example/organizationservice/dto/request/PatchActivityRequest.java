package com.example.organizationservice.dto.request;

import com.example.organizationservice.entity.Activity;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Partial update: null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatchActivityRequest {

    @Size(min = 1, max = Activity.NAME_MAX_LENGTH, message = "Name must be between 1 and 128 characters")
    @Pattern(regexp = ".*\\S.*", message = "Name must not be blank")
    private String name;

    private UUID parentId;
}
