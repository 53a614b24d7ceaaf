package com.example.organizationservice.specification;

/**
 * Negation. Reports under the inner rule's name when the inner rule passes.
 */
public class NotSpecification<T> implements Specification<T> {

    private static final String DESCRIPTION_FORMAT = "Expected condition to NOT satisfy: %s";

    private final Specification<T> inner;

    NotSpecification(Specification<T> inner) {
        this.inner = inner;
    }

    @Override
    public String getDescription() {
        return String.format(DESCRIPTION_FORMAT, inner.getDescription());
    }

    @Override
    public EvaluationResult evaluate(T candidate) {
        boolean satisfied = !inner.evaluate(candidate).isSatisfied();
        return EvaluationResult.leaf(satisfied, inner.getName(), getDescription());
    }
}
