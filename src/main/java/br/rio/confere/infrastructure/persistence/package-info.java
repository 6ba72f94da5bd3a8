/**
 * File-based persistence: checkpoints, per-processo artifacts, run summaries, company seeds, and
 * conformity-only input pairs.
 * <p><strong>Serialization:</strong> Jackson databind with JSR-310 for JSON and the CSV dataformat for tabular files.</p>
 * <p><strong>Failure model:</strong> Write failures raise {@link br.rio.confere.application.error.PersistenceException},
 * which ends the run; unreadable inputs raise {@link br.rio.confere.application.error.ParsingException}.</p>
 */
package br.rio.confere.infrastructure.persistence;
