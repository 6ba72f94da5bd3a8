/**
 * CLI entry points for the run, resume, and conformity commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, merges configuration,
 * configures logging and telemetry, and invokes use cases.</p>
 * <p><strong>Exit codes:</strong> see {@link br.rio.confere.api.ExitCode}.</p>
 * <p><strong>Security:</strong> Validates user-supplied paths and URLs; never prints the extraction API key.</p>
 */
package br.rio.confere.api;
