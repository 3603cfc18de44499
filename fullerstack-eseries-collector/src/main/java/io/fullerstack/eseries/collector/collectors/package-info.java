/**
 * Collection tasks, one per metric class: statistics (with drive locations and SSD wear),
 * failures, major event log, power, temperature and inventory.
 */
package io.fullerstack.eseries.collector.collectors;
