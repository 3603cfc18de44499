package io.fullerstack.eseries.core.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Typed value of a point field.
 * <p>
 * {@link Absent} is the sentinel for a declared field whose source value was missing
 * or could not be coerced. Points always carry every declared field key, so consumers
 * see a stable schema even when the upstream payload is incomplete.
 */
public sealed interface FieldValue
        permits FieldValue.FloatValue, FieldValue.IntegerValue, FieldValue.TextValue,
                FieldValue.BoolValue, FieldValue.Absent {

    static FieldValue of(double value) {
        return new FloatValue(value);
    }

    static FieldValue of(long value) {
        return new IntegerValue(value);
    }

    static FieldValue of(String value) {
        return value == null ? Absent.INSTANCE : new TextValue(value);
    }

    static FieldValue of(boolean value) {
        return new BoolValue(value);
    }

    static FieldValue absent() {
        return Absent.INSTANCE;
    }

    /**
     * @return true unless this is the {@link Absent} sentinel
     */
    default boolean isPresent() {
        return true;
    }

    /**
     * Numeric view of the value, empty for text, booleans and absent values.
     */
    default OptionalDouble numeric() {
        return OptionalDouble.empty();
    }

    record FloatValue(double value) implements FieldValue {
        @Override
        public OptionalDouble numeric() {
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        }
    }

    record IntegerValue(long value) implements FieldValue {
        @Override
        public OptionalDouble numeric() {
            return OptionalDouble.of(value);
        }
    }

    record TextValue(String value) implements FieldValue {
        public TextValue {
            Objects.requireNonNull(value, "value cannot be null");
        }
    }

    record BoolValue(boolean value) implements FieldValue {
    }

    enum Absent implements FieldValue {
        INSTANCE;

        @Override
        public boolean isPresent() {
            return false;
        }
    }
}
