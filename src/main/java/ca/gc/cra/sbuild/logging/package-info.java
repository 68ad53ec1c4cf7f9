/**
 * Logging setup and log hygiene helpers shared by the CLI and the adapters.
 */
package ca.gc.cra.sbuild.logging;
