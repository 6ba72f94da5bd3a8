/**
 * HTTP adapter for the structured-extraction service (OpenAI-compatible chat completions over
 * {@code java.net.http}, Jackson for the wire format).
 * <p><strong>Security:</strong> The API key is read from the environment variable named by
 * {@code extractionApiKeyEnv} and is never logged.</p>
 */
package br.rio.confere.infrastructure.extraction;
