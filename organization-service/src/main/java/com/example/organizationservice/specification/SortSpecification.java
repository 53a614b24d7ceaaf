package com.example.organizationservice.specification;

import lombok.Getter;

import java.util.Objects;

/**
 * Sort order on a single field. Declared unbound once per sortable field and
 * bound to a direction per request.
 */
@Getter
public final class SortSpecification {

    private final String field;
    @Getter(lombok.AccessLevel.NONE)
    private final SpecValue<SortDirection> direction;

    private SortSpecification(String field, SpecValue<SortDirection> direction) {
        this.field = Objects.requireNonNull(field, "field");
        this.direction = direction;
    }

    public static SortSpecification of(String field) {
        return new SortSpecification(field, SpecValue.unbound());
    }

    public SortSpecification withDirection(SortDirection boundDirection) {
        return new SortSpecification(field, SpecValue.bound(Objects.requireNonNull(boundDirection, "direction")));
    }

    /**
     * @throws UnboundSpecificationValueException if no direction has been bound
     */
    public SortDirection getDirection() {
        return direction.get(toString());
    }

    @Override
    public String toString() {
        return "<SortSpecification: " + field + ">";
    }
}
