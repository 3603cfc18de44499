package io.fullerstack.eseries.core.model;

/**
 * Declared type of a catalog field. Raw payload values are coerced to this type.
 */
public enum FieldType {
    FLOAT,
    INTEGER,
    STRING,
    BOOLEAN
}
