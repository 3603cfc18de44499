package io.fullerstack.eseries.core.catalog;

import io.fullerstack.eseries.core.model.FieldType;

import java.util.Objects;

/**
 * One declared field of a metric class.
 *
 * @param name Field key, identical to the key in the upstream JSON record
 * @param type Type raw values are coerced to
 * @param kind Counter, gauge or attribute
 */
public record FieldSpec(
        String name,
        FieldType type,
        FieldKind kind
) {
    public FieldSpec {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (kind == FieldKind.COUNTER && type != FieldType.FLOAT) {
            throw new IllegalArgumentException("counter field '" + name + "' must be FLOAT");
        }
    }

    public static FieldSpec counter(String name) {
        return new FieldSpec(name, FieldType.FLOAT, FieldKind.COUNTER);
    }

    public static FieldSpec gauge(String name) {
        return new FieldSpec(name, FieldType.FLOAT, FieldKind.GAUGE);
    }

    public static FieldSpec integer(String name) {
        return new FieldSpec(name, FieldType.INTEGER, FieldKind.ATTRIBUTE);
    }

    public static FieldSpec text(String name) {
        return new FieldSpec(name, FieldType.STRING, FieldKind.ATTRIBUTE);
    }

    public static FieldSpec flag(String name) {
        return new FieldSpec(name, FieldType.BOOLEAN, FieldKind.ATTRIBUTE);
    }

    /**
     * @return true for numeric fields that can be averaged by a downsample rule
     */
    public boolean aggregatable() {
        return type == FieldType.FLOAT;
    }
}
