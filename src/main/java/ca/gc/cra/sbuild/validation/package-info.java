/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing, configuration bootstrap and the
 * descriptor field checks (identifiers, URLs, categories, package types).
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct logging; configuration failures surface via
 * {@link IllegalArgumentException}, descriptor predicates return {@code boolean}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sbuild.validation;
