/**
 * <strong>Purpose:</strong> Descriptor shapes before and after validation: the raw ordered document, the
 * recursive package-override tree and the validated descriptor.
 * <p><strong>Concurrency:</strong> All types are immutable after construction.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sbuild.domain.descriptor;
