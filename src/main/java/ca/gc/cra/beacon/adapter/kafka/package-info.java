/**
 * <strong>Purpose:</strong> Kafka adapter that ships relayed agent telemetry upstream.
 * <p><strong>Concurrency:</strong> Driven by the single reporter thread; producer callbacks run on the Kafka I/O thread.</p>
 * <p><strong>Observability:</strong> Emits {@code sink.kafka.*} counters.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.adapter.kafka;
