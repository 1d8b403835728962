/**
 * Configuration loading for the metrics endpoint and rate logging sites.
 * <p><strong>Role:</strong> Bootstrap layer turning YAML files, system properties, and environment variables into
 * validated configuration values.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package ca.gc.cra.ratemetrics.config;
