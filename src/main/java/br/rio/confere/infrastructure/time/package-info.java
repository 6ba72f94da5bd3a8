/**
 * Time-related infrastructure adapters implementing clock ports.
 * <p><strong>Role:</strong> Adapter layer providing the wall clock and the blocking sleep behind render waits,
 * CAPTCHA waits, and extraction backoff.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package br.rio.confere.infrastructure.time;
