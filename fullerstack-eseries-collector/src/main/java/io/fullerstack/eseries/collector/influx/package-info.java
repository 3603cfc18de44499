/**
 * InfluxDB 1.x adapters: the InfluxQL query client, the failure state and MEL cursor
 * stores, and the retention backend.
 */
package io.fullerstack.eseries.collector.influx;
