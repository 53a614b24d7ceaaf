package com.example.organizationservice.specification;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Lowers field and sort specifications into JPA Criteria predicates and orders.
 */
public final class CriteriaSpecificationTranslator {

    private CriteriaSpecificationTranslator() {
    }

    public static <E> List<Predicate> toPredicates(Root<E> root,
                                                   CriteriaBuilder cb,
                                                   Collection<? extends FieldSpecification<E, ?>> specifications) {
        List<Predicate> predicates = new ArrayList<>();
        if (specifications == null) {
            return predicates;
        }
        for (FieldSpecification<E, ?> specification : specifications) {
            predicates.add(toPredicate(root, cb, specification));
        }
        return predicates;
    }

    /**
     * Sorts are applied in the given order. No tiebreaker is appended, so rows
     * with equal keys come back in whatever order the database chooses.
     */
    public static List<Order> toOrders(Root<?> root, CriteriaBuilder cb, Collection<SortSpecification> sorts) {
        List<Order> orders = new ArrayList<>();
        if (sorts == null) {
            return orders;
        }
        for (SortSpecification sort : sorts) {
            Path<?> path = PropertyPaths.resolve(root, sort.getField());
            orders.add(switch (sort.getDirection()) {
                case ASC -> cb.asc(path);
                case DESC -> cb.desc(path);
            });
        }
        return orders;
    }

    public static Predicate toPredicate(Root<?> root, CriteriaBuilder cb, FieldSpecification<?, ?> specification) {
        Path<?> path = PropertyPaths.resolve(root, specification.getField());
        Object value = specification.getValue();

        return switch (specification.getKind()) {
            case EQUALS -> cb.equal(path, value);
            case NOT_EQUALS -> cb.notEqual(path, value);
            case GREATER_THAN, LESS_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN_OR_EQUAL ->
                    compare(cb, path, specification.getKind(), value);
            case IN_LIST -> in(cb, path, (Collection<?>) value);
            case NOT_IN_LIST -> cb.not(in(cb, path, (Collection<?>) value));
            case SUB_LIST -> equalsAny(cb, path, (Collection<?>) value);
            case NOT_SUB_LIST -> cb.not(equalsAny(cb, path, (Collection<?>) value));
            case LIKE -> cb.like(text(path), LikePatterns.contains((String) value), LikePatterns.ESCAPE_CHAR);
            case NOT_LIKE -> cb.notLike(text(path), LikePatterns.contains((String) value), LikePatterns.ESCAPE_CHAR);
            case ILIKE -> cb.like(cb.lower(text(path)), lowerContains(value), LikePatterns.ESCAPE_CHAR);
            case NOT_ILIKE -> cb.notLike(cb.lower(text(path)), lowerContains(value), LikePatterns.ESCAPE_CHAR);
            case IS_NULL -> (Boolean) value ? cb.isNull(path) : cb.isNotNull(path);
            case IS_NOT_NULL -> (Boolean) value ? cb.isNotNull(path) : cb.isNull(path);
        };
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Predicate compare(CriteriaBuilder cb, Path<?> path, PredicateKind kind, Object value) {
        Expression<Comparable> expression = (Expression<Comparable>) path;
        Comparable comparable = (Comparable) value;
        return switch (kind) {
            case GREATER_THAN -> cb.greaterThan(expression, comparable);
            case LESS_THAN -> cb.lessThan(expression, comparable);
            case GREATER_THAN_OR_EQUAL -> cb.greaterThanOrEqualTo(expression, comparable);
            case LESS_THAN_OR_EQUAL -> cb.lessThanOrEqualTo(expression, comparable);
            default -> throw new IllegalArgumentException("Not an ordering predicate: " + kind);
        };
    }

    private static Predicate in(CriteriaBuilder cb, Path<?> path, Collection<?> values) {
        if (values.isEmpty()) {
            return cb.disjunction();
        }
        return path.in(values);
    }

    // Scalar columns: "every value is contained" degrades to "equals any value".
    private static Predicate equalsAny(CriteriaBuilder cb, Path<?> path, Collection<?> values) {
        if (values.isEmpty()) {
            return cb.conjunction();
        }
        return cb.or(values.stream()
                .map(v -> cb.equal(path, v))
                .toArray(Predicate[]::new));
    }

    @SuppressWarnings("unchecked")
    private static Expression<String> text(Path<?> path) {
        return (Expression<String>) path;
    }

    private static String lowerContains(Object value) {
        return LikePatterns.contains((String) value).toLowerCase(Locale.ROOT);
    }
}
