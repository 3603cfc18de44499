/**
 * Drive location lookup (tray and slot) used to tag drive statistics.
 */
package io.fullerstack.eseries.collector.location;
