package com.example.organizationservice.exception;

import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Exception for resource not found errors (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message, Map<String, Object> details) {
        super(code, message, HttpStatus.NOT_FOUND, details);
    }

    public static ResourceNotFoundException activityNotFound(UUID activityId) {
        return activitiesNotFound(List.of(activityId));
    }

    /**
     * One or more referenced activities do not exist; details list exactly the missing ids.
     */
    public static ResourceNotFoundException activitiesNotFound(List<UUID> activityIds) {
        return new ResourceNotFoundException(
            "ACTIVITY_NOT_FOUND",
            String.format("Activities not found: %s", activityIds),
            Map.of("activityIds", List.copyOf(activityIds))
        );
    }

    public static ResourceNotFoundException buildingNotFound(UUID buildingId) {
        return new ResourceNotFoundException(
            "BUILDING_NOT_FOUND",
            String.format("Building with ID %s not found", buildingId),
            Map.of("buildingId", buildingId)
        );
    }

    public static ResourceNotFoundException organizationNotFound(UUID organizationId) {
        return new ResourceNotFoundException(
            "ORGANIZATION_NOT_FOUND",
            String.format("Organization with ID %s not found", organizationId),
            Map.of("organizationId", organizationId)
        );
    }
}
