/**
 * Ports connecting the pipeline use cases to browsers, documents, extraction, storage, and telemetry.
 * <p><strong>Role:</strong> Application layer boundary; adapters live under {@code br.rio.confere.infrastructure}.</p>
 */
package br.rio.confere.application.port;
