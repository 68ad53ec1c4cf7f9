/**
 * Descriptor validation: the field registry, the document walk, duplicate detection and the per-file
 * lint use case.
 */
package ca.gc.cra.sbuild.application.lint;
