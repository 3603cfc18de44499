/**
 * Immutable value types shared by the collection engine: systems, metric classes,
 * points with typed field values, counter samples, failure records and MEL queries.
 */
package io.fullerstack.eseries.core.model;
