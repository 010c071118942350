package com.phillippitts.talkbox.service.supervisor;

import com.phillippitts.talkbox.service.metrics.PipelineMetrics;
import com.phillippitts.talkbox.service.supervisor.event.ConnectionStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest known status of every supervised connection, built from state change events.
 *
 * <p>Readers (health indicator, status endpoint, admin commands) use this instead of holding the
 * supervisors themselves, which only exist once the lifecycle coordinator has started.
 */
@Component
public class ConnectionStatusRegistry {

    private static final Logger LOG = LogManager.getLogger(ConnectionStatusRegistry.class);

    private final Map<String, ConnectionStatus> latest = new ConcurrentHashMap<>();
    private final PipelineMetrics metrics;

    public ConnectionStatusRegistry(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    public void onStateChanged(ConnectionStateChangedEvent e) {
        boolean running = e.current() != ConnectionState.DISCONNECTED;
        latest.compute(e.name(), (name, prev) -> {
            String lastError = e.error() != null ? e.error() : (prev == null ? null : prev.lastError());
            return new ConnectionStatus(name, e.current(), e.retryCount(), lastError, e.at(), running);
        });
        metrics.recordConnectionState(e.name(), e.current());
    }

    /** Statuses sorted by adapter name. */
    public List<ConnectionStatus> statuses() {
        return latest.values().stream()
                .sorted(Comparator.comparing(ConnectionStatus::name))
                .toList();
    }

    @Scheduled(fixedRate = 60_000)
    void logSummary() {
        if (latest.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder("Connection states: ");
        statuses().forEach(c -> sb.append(c.name()).append('=').append(c.state())
                .append("(retries=").append(c.retryCount()).append(") "));
        LOG.info(sb.toString().trim());
    }
}
