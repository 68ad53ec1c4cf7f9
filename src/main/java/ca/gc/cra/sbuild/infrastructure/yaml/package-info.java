/**
 * SnakeYAML adapters for reading and writing descriptors.
 */
package ca.gc.cra.sbuild.infrastructure.yaml;
