package com.example.organizationservice.specification;

/**
 * Value slot of a specification template: either not yet bound or bound to a
 * concrete value. Templates are declared {@link Unbound} and cloned with a
 * bound value per request.
 *
 * @param <V> value type
 */
public sealed interface SpecValue<V> permits SpecValue.Unbound, SpecValue.Bound {

    static <V> SpecValue<V> unbound() {
        return new Unbound<>();
    }

    static <V> SpecValue<V> bound(V value) {
        return new Bound<>(value);
    }

    /**
     * @param owner description of the template, used in the error message
     * @throws UnboundSpecificationValueException if no value has been bound
     */
    V get(String owner);

    boolean isBound();

    record Unbound<V>() implements SpecValue<V> {

        @Override
        public V get(String owner) {
            throw new UnboundSpecificationValueException(owner);
        }

        @Override
        public boolean isBound() {
            return false;
        }
    }

    record Bound<V>(V value) implements SpecValue<V> {

        @Override
        public V get(String owner) {
            return value;
        }

        @Override
        public boolean isBound() {
            return true;
        }
    }
}
