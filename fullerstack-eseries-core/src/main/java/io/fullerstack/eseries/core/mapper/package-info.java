/**
 * Conversion of raw API records into normalized points.
 * <p>
 * {@link io.fullerstack.eseries.core.mapper.PointMapper} applies a class catalog to a record;
 * {@link io.fullerstack.eseries.core.mapper.SensorPayload} and
 * {@link io.fullerstack.eseries.core.mapper.PowerPayload} unify the alternative response
 * shapes of the environmental endpoints before mapping.
 */
package io.fullerstack.eseries.core.mapper;
