/**
 * Executor construction and external process execution.
 */
package ca.gc.cra.sbuild.infrastructure.exec;
