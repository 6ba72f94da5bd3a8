/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep document text and secrets out of logs.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; MDC keys {@code company}, {@code processo}
 * and {@code state} are set by the pipeline and rendered by {@code logback.xml}.</p>
 */
package br.rio.confere.logging;
