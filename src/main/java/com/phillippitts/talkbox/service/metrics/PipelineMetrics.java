package com.phillippitts.talkbox.service.metrics;

import com.phillippitts.talkbox.service.pipeline.ItemOutcome;
import com.phillippitts.talkbox.service.pipeline.PipelineStage;
import com.phillippitts.talkbox.service.queue.EnqueueResult;
import com.phillippitts.talkbox.service.queue.QueueManager;
import com.phillippitts.talkbox.service.supervisor.ConnectionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the queue, response pipeline and connection supervisors.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Queue depth and capacity (gauges)</li>
 *   <li>Enqueue results by status</li>
 *   <li>Per-stage pipeline latency</li>
 *   <li>Item outcomes</li>
 *   <li>Connection state transitions per adapter</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "talkbox";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry, QueueManager queueManager) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".queue.size", queueManager, QueueManager::getSize)
                .description("Items waiting in the queue")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".queue.capacity", queueManager, QueueManager::getMaxSize)
                .description("Maximum queue size")
                .register(registry);
    }

    /**
     * Counts an enqueue attempt.
     *
     * @param status result status of the attempt
     */
    public void recordEnqueue(EnqueueResult.Status status) {
        Counter.builder(METRIC_PREFIX + ".queue.enqueue")
                .description("Enqueue attempts by result")
                .tag("status", tagValue(status))
                .register(registry)
                .increment();
    }

    /**
     * Records how long one pipeline stage took for one item.
     *
     * @param stage stage that ran
     * @param durationNanos duration in nanoseconds
     */
    public void recordStageLatency(PipelineStage stage, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".pipeline.stage.latency")
                .description("Time spent in a pipeline stage")
                .tag("stage", tagValue(stage))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordOutcome(ItemOutcome outcome) {
        Counter.builder(METRIC_PREFIX + ".pipeline.items")
                .description("Items that left the pipeline, by outcome")
                .tag("outcome", tagValue(outcome))
                .register(registry)
                .increment();
    }

    public void recordConnectionState(String adapter, ConnectionState state) {
        Counter.builder(METRIC_PREFIX + ".connection.transitions")
                .description("Connection state changes per adapter")
                .tag("adapter", adapter)
                .tag("state", tagValue(state))
                .register(registry)
                .increment();
    }

    private static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
