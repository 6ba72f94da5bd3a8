/**
 * Configuration records, YAML loading, default maps, and the composition root for the CONFERE CLIs.
 * <p><strong>Role:</strong> Bootstrap layer turning CLI and YAML settings into an immutable
 * {@link br.rio.confere.config.PipelineConfig} and wiring adapters around it.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> The extraction API key is read from the environment at wiring time and never
 * stored in configuration or logs.</p>
 */
package br.rio.confere.config;
