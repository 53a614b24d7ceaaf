package com.example.organizationservice.specification;

/**
 * Satisfied only when both operands are satisfied.
 */
public class AndSpecification<T> extends CompositeSpecification<T> {

    AndSpecification(Specification<T> left, Specification<T> right) {
        super(left, right);
    }

    @Override
    protected boolean combine(boolean left, boolean right) {
        return left && right;
    }

    @Override
    public String getDescription() {
        return "(" + getLeft().getDescription() + ") AND (" + getRight().getDescription() + ")";
    }
}
