/**
 * <strong>Purpose:</strong> Diagnostic value types and the per-field diagnostic store used by the descriptor walk.
 * <p><strong>Concurrency:</strong> Values are immutable; {@link ca.gc.cra.sbuild.domain.diagnostic.DiagnosticStore}
 * is confined to one validation pass.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sbuild.domain.diagnostic;
