/**
 * Application ports for rate reporting.
 * <p><strong>Role:</strong> Seams between stream combinators and the logging/Prometheus side effects.</p>
 * <p><strong>Concurrency:</strong> Implementations are invoked from timer threads as well as pipeline threads.</p>
 */
package ca.gc.cra.ratemetrics.application.port;
