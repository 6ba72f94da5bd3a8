/**
 * Infrastructure adapters implementing the application ports: browsers, HTTP, PDF text, files, clock, and
 * metrics.
 */
package br.rio.confere.infrastructure;
