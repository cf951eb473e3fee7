/**
 * LMAX Disruptor pipeline carrying dispatch outcomes to the metrics registry.
 *
 * <pre>
 * Dispatcher threads --tryNext/publish--> RingBuffer&lt;DispatchEvent&gt; --> MetricsEventHandler --> Micrometer
 * </pre>
 *
 * A full ring buffer drops the event and increments {@code aimux_metrics_events_dropped_total}.
 */
package fr.lapetina.aimux.disruptor;
