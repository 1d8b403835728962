/**
 * <strong>Purpose:</strong> {@link java.util.stream.Stream} combinators that tap pipelines for rate reporting.
 * <p><strong>Concurrency:</strong> Combinators add no threads of their own; rate gauges may.</p>
 * <p><strong>Performance:</strong> Constant memory per combinator: one countdown, no buffering.</p>
 */
package ca.gc.cra.ratemetrics.application.stream;
