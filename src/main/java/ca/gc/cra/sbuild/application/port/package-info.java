/**
 * <strong>Purpose:</strong> Ports between the lint use cases and their adapters: descriptor codec, external
 * analysis tools, result lists, console output and metrics.
 * <p><strong>Concurrency:</strong> Every port may be called from several lint workers at once.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sbuild.application.port;
