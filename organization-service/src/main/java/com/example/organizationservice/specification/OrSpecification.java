package com.example.organizationservice.specification;

/**
 * Satisfied when either operand is satisfied.
 */
public class OrSpecification<T> extends CompositeSpecification<T> {

    OrSpecification(Specification<T> left, Specification<T> right) {
        super(left, right);
    }

    @Override
    protected boolean combine(boolean left, boolean right) {
        return left || right;
    }

    @Override
    public String getDescription() {
        return "(" + getLeft().getDescription() + ") OR (" + getRight().getDescription() + ")";
    }
}
