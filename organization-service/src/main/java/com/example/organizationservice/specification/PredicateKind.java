package com.example.organizationservice.specification;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of field predicates understood by the query engine.
 * {@link CriteriaSpecificationTranslator} and {@link FieldSpecification}
 * switch over every constant without a default branch.
 */
@Getter
@RequiredArgsConstructor
public enum PredicateKind {

    EQUALS("EqualsSpecification", "Matches when field == value."),
    NOT_EQUALS("NotEqualsSpecification", "Matches when field != value."),
    GREATER_THAN("GreaterThanSpecification", "Matches when field > value."),
    LESS_THAN("LessThanSpecification", "Matches when field < value."),
    GREATER_THAN_OR_EQUAL("GreaterThanOrEqualsToSpecification", "Matches when field >= value."),
    LESS_THAN_OR_EQUAL("LessThanOrEqualsToSpecification", "Matches when field <= value."),
    IN_LIST("InListSpecification", "Matches when field in value."),
    NOT_IN_LIST("NotInListSpecification", "Matches when field not in value."),
    SUB_LIST("SubListSpecification", "Matches when set(value) is a subset of set(field)."),
    NOT_SUB_LIST("NotSubListSpecification", "Matches when set(value) is not a subset of set(field)."),
    LIKE("LikeSpecification", "Matches when field contains value (case-sensitive)."),
    NOT_LIKE("NotLikeSpecification", "Matches when LikeSpecification does not match."),
    ILIKE("ILikeSpecification", "Matches when field contains value (case-insensitive)."),
    NOT_ILIKE("NotILikeSpecification", "Matches when ILikeSpecification does not match."),
    IS_NULL("IsNoneSpecification", "True means field must be null; false means field must not be null."),
    IS_NOT_NULL("IsNotNoneSpecification", "True means field must not be null; false means field must be null.");

    private final String specificationName;
    private final String description;
}
