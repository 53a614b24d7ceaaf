package com.example.organizationservice.specification;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for binary combinators. Both operands are always evaluated and the
 * errors of both are merged, whatever the combined verdict.
 */
@Getter(AccessLevel.PROTECTED)
public abstract class CompositeSpecification<T> implements Specification<T> {

    private final Specification<T> left;
    private final Specification<T> right;

    protected CompositeSpecification(Specification<T> left, Specification<T> right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public EvaluationResult evaluate(T candidate) {
        EvaluationResult leftResult = left.evaluate(candidate);
        EvaluationResult rightResult = right.evaluate(candidate);

        Map<String, String> errors = new LinkedHashMap<>(leftResult.getErrors());
        errors.putAll(rightResult.getErrors());

        return EvaluationResult.of(combine(leftResult.isSatisfied(), rightResult.isSatisfied()), errors);
    }

    protected abstract boolean combine(boolean left, boolean right);
}
