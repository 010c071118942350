package com.phillippitts.talkbox.service.health;

import com.phillippitts.talkbox.service.lifecycle.LifecycleCoordinator;
import com.phillippitts.talkbox.service.queue.QueueManager;
import com.phillippitts.talkbox.service.queue.QueueSnapshot;
import com.phillippitts.talkbox.service.supervisor.ConnectionState;
import com.phillippitts.talkbox.service.supervisor.ConnectionStatus;
import com.phillippitts.talkbox.service.supervisor.ConnectionStatusRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for the orchestration core.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: queue open with room, every adapter connected or connecting</li>
 *   <li>DEGRADED: an adapter is retrying or gone, or the queue is full or paused</li>
 *   <li>DOWN: shutting down, or the queue is closed</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final QueueManager queue;
    private final ConnectionStatusRegistry connections;
    private final LifecycleCoordinator coordinator;

    public PipelineHealthIndicator(QueueManager queue,
                                   ConnectionStatusRegistry connections,
                                   LifecycleCoordinator coordinator) {
        this.queue = queue;
        this.connections = connections;
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        QueueSnapshot q = queue.snapshot();
        List<ConnectionStatus> conns = connections.statuses();
        boolean adaptersDegraded = conns.stream().anyMatch(PipelineHealthIndicator::isDegraded);

        Health.Builder builder = new Health.Builder();
        if (coordinator.isStopping() || q.closed()) {
            builder.down().withDetail("status", "Shutting down");
        } else if (adaptersDegraded || q.isFull() || q.paused()) {
            builder.status("DEGRADED").withDetail("status", degradedReason(adaptersDegraded, q));
        } else {
            builder.up().withDetail("status", "Operational");
        }

        return builder
                .withDetail("queue", q.size() + "/" + q.capacity())
                .withDetail("paused", q.paused())
                .withDetail("avatar", coordinator.isAvatarConnected() ? "connected" : "not connected")
                .withDetail("connections", connectionDetails(conns))
                .build();
    }

    private static boolean isDegraded(ConnectionStatus c) {
        return c.state() == ConnectionState.RETRYING || c.state() == ConnectionState.DISCONNECTED;
    }

    private static String degradedReason(boolean adaptersDegraded, QueueSnapshot q) {
        if (adaptersDegraded) {
            return "Adapter connection lost";
        }
        return q.paused() ? "Queue paused" : "Queue full";
    }

    private static Map<String, String> connectionDetails(List<ConnectionStatus> conns) {
        Map<String, String> details = new LinkedHashMap<>();
        for (ConnectionStatus c : conns) {
            String value = c.state().name().toLowerCase(Locale.ROOT);
            if (c.lastError() != null && c.state() == ConnectionState.RETRYING) {
                value += " (retries=" + c.retryCount() + ")";
            }
            details.put(c.name(), value);
        }
        return details;
    }
}
