/**
 * <strong>Purpose:</strong> Input validation for CLI arguments and YAML configuration.
 * <p><strong>Concurrency:</strong> Stateless helpers.</p>
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException} that the CLI
 * reports as invalid configuration.</p>
 */
package br.rio.confere.validation;
