/**
 * Browser and HTTP adapters for the ContasRio portal and the DoWeb gazette, built on Selenium WebDriver.
 * <p><strong>Concurrency:</strong> One browser session per adapter, driven by the single pipeline worker.</p>
 * <p><strong>Failure model:</strong> A browser that cannot start raises
 * {@link br.rio.confere.application.error.PortalUnavailableException}; pages that fail to load raise
 * {@link br.rio.confere.application.error.PageLoadException}; pages that never settle or that the browser loses
 * raise {@link br.rio.confere.application.error.NavigationTimeoutException}; failed downloads raise
 * {@link br.rio.confere.application.error.ParsingException}.</p>
 */
package br.rio.confere.infrastructure.web;
