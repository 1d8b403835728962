/**
 * Rate computation: turns per-tick event counts into counter deltas, per-second gauge values, and log lines.
 * <p><strong>Concurrency:</strong> Stateless apart from immutable configuration; safe for timer threads.</p>
 * <p><strong>Observability:</strong> Rate lines go to the SLF4J logger named by each site's label.</p>
 */
package ca.gc.cra.ratemetrics.application.rate;
