package com.example.organizationservice.specification;

import lombok.Getter;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Predicate over a single (possibly dotted) field of a candidate.
 * Instances are immutable; factory methods create unbound templates and
 * {@link #withValue} returns a bound copy.
 *
 * @param <T> candidate type
 * @param <V> bound value type
 */
@Getter
public final class FieldSpecification<T, V> implements Specification<T> {

    private final PredicateKind kind;
    private final String field;
    @Getter(lombok.AccessLevel.NONE)
    private final SpecValue<V> value;

    private FieldSpecification(PredicateKind kind, String field, SpecValue<V> value) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.field = Objects.requireNonNull(field, "field");
        this.value = value;
    }

    public static <T> FieldSpecification<T, Object> equalTo(String field) {
        return new FieldSpecification<>(PredicateKind.EQUALS, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, Object> notEqualTo(String field) {
        return new FieldSpecification<>(PredicateKind.NOT_EQUALS, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, Comparable<?>> greaterThan(String field) {
        return new FieldSpecification<>(PredicateKind.GREATER_THAN, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, Comparable<?>> lessThan(String field) {
        return new FieldSpecification<>(PredicateKind.LESS_THAN, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, Comparable<?>> greaterThanOrEqualTo(String field) {
        return new FieldSpecification<>(PredicateKind.GREATER_THAN_OR_EQUAL, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, Comparable<?>> lessThanOrEqualTo(String field) {
        return new FieldSpecification<>(PredicateKind.LESS_THAN_OR_EQUAL, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, Collection<?>> inList(String field) {
        return new FieldSpecification<>(PredicateKind.IN_LIST, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, Collection<?>> notInList(String field) {
        return new FieldSpecification<>(PredicateKind.NOT_IN_LIST, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, Collection<?>> subList(String field) {
        return new FieldSpecification<>(PredicateKind.SUB_LIST, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, Collection<?>> notSubList(String field) {
        return new FieldSpecification<>(PredicateKind.NOT_SUB_LIST, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, String> like(String field) {
        return new FieldSpecification<>(PredicateKind.LIKE, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, String> notLike(String field) {
        return new FieldSpecification<>(PredicateKind.NOT_LIKE, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, String> ilike(String field) {
        return new FieldSpecification<>(PredicateKind.ILIKE, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, String> notIlike(String field) {
        return new FieldSpecification<>(PredicateKind.NOT_ILIKE, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, Boolean> isNull(String field) {
        return new FieldSpecification<>(PredicateKind.IS_NULL, field, SpecValue.unbound());
    }

    public static <T> FieldSpecification<T, Boolean> isNotNull(String field) {
        return new FieldSpecification<>(PredicateKind.IS_NOT_NULL, field, SpecValue.unbound());
    }

    /**
     * Copy of this template bound to the given value.
     */
    public FieldSpecification<T, V> withValue(V boundValue) {
        return new FieldSpecification<>(kind, field, SpecValue.bound(boundValue));
    }

    /**
     * @throws UnboundSpecificationValueException if this is an unbound template
     */
    public V getValue() {
        return value.get(toString());
    }

    public boolean isBound() {
        return value.isBound();
    }

    @Override
    public String getName() {
        return kind.getSpecificationName();
    }

    @Override
    public String getDescription() {
        return kind.getDescription();
    }

    @Override
    public EvaluationResult evaluate(T candidate) {
        Object expected = getValue();
        Object actual = PropertyPaths.read(candidate, field);
        return EvaluationResult.leaf(matches(actual, expected), getName(), getDescription());
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private boolean matches(Object actual, Object expected) {
        return switch (kind) {
            case EQUALS -> Objects.equals(actual, expected);
            case NOT_EQUALS -> !Objects.equals(actual, expected);
            case GREATER_THAN -> ((Comparable) actual).compareTo(expected) > 0;
            case LESS_THAN -> ((Comparable) actual).compareTo(expected) < 0;
            case GREATER_THAN_OR_EQUAL -> ((Comparable) actual).compareTo(expected) >= 0;
            case LESS_THAN_OR_EQUAL -> ((Comparable) actual).compareTo(expected) <= 0;
            case IN_LIST -> ((Collection<?>) expected).contains(actual);
            case NOT_IN_LIST -> !((Collection<?>) expected).contains(actual);
            case SUB_LIST -> isSubset((Collection<?>) expected, (Collection<?>) actual);
            case NOT_SUB_LIST -> !isSubset((Collection<?>) expected, (Collection<?>) actual);
            case LIKE -> LikePatterns.containsMatch((String) actual, (String) expected, false);
            case NOT_LIKE -> !LikePatterns.containsMatch((String) actual, (String) expected, false);
            case ILIKE -> LikePatterns.containsMatch((String) actual, (String) expected, true);
            case NOT_ILIKE -> !LikePatterns.containsMatch((String) actual, (String) expected, true);
            case IS_NULL -> (Boolean) expected ? actual == null : actual != null;
            case IS_NOT_NULL -> (Boolean) expected ? actual != null : actual == null;
        };
    }

    private static boolean isSubset(Collection<?> subset, Collection<?> superset) {
        Set<?> elements = new HashSet<>(superset);
        return elements.containsAll(subset);
    }

    @Override
    public String toString() {
        return "<" + getName() + ": " + field + ">";
    }
}
