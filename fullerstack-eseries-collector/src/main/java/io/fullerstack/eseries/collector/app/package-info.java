/**
 * Application entry point and startup helpers.
 */
package io.fullerstack.eseries.collector.app;
