package com.example.organizationservice.specification;

/**
 * Thrown when a specification template is used before a value was bound to it.
 * Always a programming error.
 */
public class UnboundSpecificationValueException extends IllegalStateException {

    public UnboundSpecificationValueException(String owner) {
        super(String.format("%s has no bound value; create an instance with withValue()/withDirection() first", owner));
    }
}
