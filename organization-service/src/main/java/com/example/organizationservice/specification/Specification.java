package com.example.organizationservice.specification;

/**
 * A business rule that can be evaluated against a candidate object.
 * Specifications compose with {@link #and}, {@link #or} and {@link #not};
 * composites evaluate both operands and merge the errors of their leaves.
 *
 * @param <T> candidate type
 */
public interface Specification<T> {

    /**
     * Human-readable description, reported when the rule is not satisfied.
     */
    String getDescription();

    /**
     * Evaluate the candidate and collect the errors of every failed leaf.
     */
    EvaluationResult evaluate(T candidate);

    default boolean isSatisfiedBy(T candidate) {
        return evaluate(candidate).isSatisfied();
    }

    /**
     * Key under which this rule reports its errors.
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    default Specification<T> and(Specification<T> other) {
        return new AndSpecification<>(this, other);
    }

    default Specification<T> or(Specification<T> other) {
        return new OrSpecification<>(this, other);
    }

    default Specification<T> not() {
        return new NotSpecification<>(this);
    }
}
