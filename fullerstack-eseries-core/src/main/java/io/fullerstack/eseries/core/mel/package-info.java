/**
 * Major event log cursors.
 */
package io.fullerstack.eseries.core.mel;
