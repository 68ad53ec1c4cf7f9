/**
 * Run configuration: YAML loading, precedence merging and adapter wiring.
 */
package ca.gc.cra.sbuild.config;
