package com.example.organizationservice.specification;

import jakarta.persistence.criteria.Path;
import org.springframework.beans.PropertyAccessorFactory;

/**
 * Dotted field path resolution, in memory and against a criteria root.
 */
public final class PropertyPaths {

    private PropertyPaths() {
    }

    public static Object read(Object candidate, String field) {
        return PropertyAccessorFactory.forBeanPropertyAccess(candidate).getPropertyValue(field);
    }

    public static Path<?> resolve(Path<?> root, String field) {
        Path<?> path = root;
        for (String part : field.split("\\.")) {
            path = path.get(part);
        }
        return path;
    }
}
