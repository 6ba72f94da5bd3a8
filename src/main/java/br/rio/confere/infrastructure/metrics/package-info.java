/**
 * Metrics adapters that bridge the CONFERE metrics port to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code pipeline.*}, {@code search.*}, and {@code extraction.*}.</p>
 * <p><strong>Security:</strong> Only counters and latencies are exported; document text never leaves the process.</p>
 */
package br.rio.confere.infrastructure.metrics;
