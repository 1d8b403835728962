/**
 * Configuration values describing rate logging sites and the Prometheus counters and gauges they feed.
 * <p><strong>Concurrency:</strong> All types are immutable apart from their builders.</p>
 * <p><strong>Metrics:</strong> Handles are owned by the registry they were registered with; this package only
 * holds and forwards them.</p>
 */
package ca.gc.cra.ratemetrics.domain.metrics;
