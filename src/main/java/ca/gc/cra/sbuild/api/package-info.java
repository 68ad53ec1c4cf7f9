/**
 * Command-line surface: argument parsing, configuration assembly and exit codes.
 */
package ca.gc.cra.sbuild.api;
