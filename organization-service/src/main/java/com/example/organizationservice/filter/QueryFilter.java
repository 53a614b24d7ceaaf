package com.example.organizationservice.filter;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Structural predicate that cannot be expressed as a single field
 * specification (subqueries, computed ranges). Filters are AND-ed onto the
 * query after the field specifications.
 *
 * @param <E> root entity type
 */
@FunctionalInterface
public interface QueryFilter<E> {

    Predicate toPredicate(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb);
}
