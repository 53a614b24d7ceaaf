package com.example.organizationservice.specification;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    /**
     * Parse "asc"/"desc" in any case.
     */
    public static SortDirection fromString(String value) {
        try {
            return SortDirection.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid sort direction: " + value + ". Expected asc or desc", e);
        }
    }
}
