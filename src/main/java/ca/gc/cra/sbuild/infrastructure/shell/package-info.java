/**
 * Adapters that run shell tooling: static analysis of build scripts and version probes.
 */
package ca.gc.cra.sbuild.infrastructure.shell;
