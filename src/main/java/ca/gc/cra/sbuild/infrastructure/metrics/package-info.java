/**
 * Metrics adapters.
 */
package ca.gc.cra.sbuild.infrastructure.metrics;
