/**
 * Prometheus adapters: metric descriptors and registration, labeled vectors, the HTTP scrape endpoint, and the
 * timer-driven rate gauge.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Registry and handle operations are thread-safe; each gauged stream has one
 * consumer thread and shares a timer thread with other streams of the same gauge.</p>
 * <p><strong>Security:</strong> The scrape endpoint has no authentication; bind it to a trusted interface.</p>
 */
package ca.gc.cra.ratemetrics.infrastructure.metrics;
