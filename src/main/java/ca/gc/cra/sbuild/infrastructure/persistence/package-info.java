/**
 * File-backed result lists.
 */
package ca.gc.cra.sbuild.infrastructure.persistence;
