/**
 * Core domain model for the CONFERE discovery → publication search → conformity pipeline.
 * <p><strong>Role:</strong> Domain layer values describing companies, processos, contracts, gazette
 * publications, and conformity verdicts without browser or storage dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Auditability:</strong> A publication that was not located is never reported as a confirmed
 * absence; see {@link br.rio.confere.domain.publication.PublicationResult}.</p>
 */
package br.rio.confere.domain;
