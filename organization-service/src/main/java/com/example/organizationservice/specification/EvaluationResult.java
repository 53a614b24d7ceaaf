package com.example.organizationservice.specification;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a specification evaluation: the verdict plus the errors
 * reported by failed leaves, keyed by specification name.
 */
@Getter
public final class EvaluationResult {

    private final boolean satisfied;
    private final Map<String, String> errors;

    private EvaluationResult(boolean satisfied, Map<String, String> errors) {
        this.satisfied = satisfied;
        this.errors = Collections.unmodifiableMap(errors);
    }

    public static EvaluationResult of(boolean satisfied, Map<String, String> errors) {
        return new EvaluationResult(satisfied, new LinkedHashMap<>(errors));
    }

    /**
     * Result of a leaf rule: reports its own description when not satisfied.
     */
    public static EvaluationResult leaf(boolean satisfied, String name, String description) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (!satisfied) {
            errors.put(name, description);
        }
        return new EvaluationResult(satisfied, errors);
    }
}
