/**
 * Executor factories for timer threads.
 */
package ca.gc.cra.ratemetrics.infrastructure.exec;
