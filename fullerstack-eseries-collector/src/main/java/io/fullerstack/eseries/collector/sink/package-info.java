/**
 * Output sinks: InfluxDB line protocol over HTTP, JSON files, logging, a Prometheus scrape
 * endpoint, and fan-out over several.
 */
package io.fullerstack.eseries.collector.sink;
