/**
 * Static schemas of the metric classes collected from a storage system.
 * <p>
 * Each {@link io.fullerstack.eseries.core.model.MetricClass} owns one
 * {@link io.fullerstack.eseries.core.catalog.MetricCatalog} listing:
 * <ul>
 *   <li>the measurement name written to the backend</li>
 *   <li>the declared fields with type and kind (counter, gauge, attribute)</li>
 *   <li>the tag keys in write order</li>
 *   <li>the upstream key identifying one entity of the class</li>
 * </ul>
 */
package io.fullerstack.eseries.core.catalog;
