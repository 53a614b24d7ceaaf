package com.example.organizationservice.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;
import java.util.UUID;

/**
 * Exception for conflict errors (HTTP 409).
 * Used for activity hierarchy rule violations.
 */
public class ConflictException extends BaseException {

    public ConflictException(String code, String message, Map<String, Object> details) {
        super(code, message, HttpStatus.CONFLICT, details);
    }

    /**
     * Attaching under the given parent would exceed the maximum nesting level.
     */
    public static ConflictException activityMaximumNesting(UUID parentId, int maxNestingLevel) {
        return new ConflictException(
            "ACTIVITY_MAXIMUM_NESTING",
            String.format("Activity %s is too deep to have children: maximum nesting level is %d",
                    parentId, maxNestingLevel),
            Map.of("parentId", parentId, "maxNestingLevel", maxNestingLevel)
        );
    }

    /**
     * The requested parent is the activity itself or one of its descendants.
     */
    public static ConflictException activityHierarchyCycle(UUID activityId, UUID parentId) {
        return new ConflictException(
            "ACTIVITY_HIERARCHY_CYCLE",
            String.format("Activity %s cannot be moved under %s: it would become its own ancestor",
                    activityId, parentId),
            Map.of("activityId", activityId, "parentId", parentId)
        );
    }
}
