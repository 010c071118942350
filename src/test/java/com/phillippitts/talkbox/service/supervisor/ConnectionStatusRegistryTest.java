package com.phillippitts.talkbox.service.supervisor;

import com.phillippitts.talkbox.service.metrics.PipelineMetrics;
import com.phillippitts.talkbox.service.queue.QueueManager;
import com.phillippitts.talkbox.service.supervisor.event.ConnectionStateChangedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionStatusRegistryTest {

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final ConnectionStatusRegistry registry =
            new ConnectionStatusRegistry(new PipelineMetrics(meters, new QueueManager(5, Set.of())));

    private static ConnectionStateChangedEvent change(String name, ConnectionState from, ConnectionState to,
                                                      int retries, String error) {
        return new ConnectionStateChangedEvent(name, from, to, retries, error, Instant.now());
    }

    @Test
    void shouldTrackLatestStateSortedByName() {
        registry.onStateChanged(change("twitch", ConnectionState.DISCONNECTED, ConnectionState.CONNECTING, 0, null));
        registry.onStateChanged(change("discord", ConnectionState.DISCONNECTED, ConnectionState.CONNECTING, 0, null));
        registry.onStateChanged(change("twitch", ConnectionState.CONNECTING, ConnectionState.CONNECTED, 0, null));

        assertThat(registry.statuses()).extracting(ConnectionStatus::name).containsExactly("discord", "twitch");
        assertThat(registry.statuses().get(1).state()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(registry.statuses().get(1).running()).isTrue();
    }

    @Test
    void shouldKeepLastErrorAcrossReconnect() {
        registry.onStateChanged(change("chat", ConnectionState.CONNECTING, ConnectionState.RETRYING, 1, "timeout"));
        registry.onStateChanged(change("chat", ConnectionState.RETRYING, ConnectionState.CONNECTING, 1, null));

        ConnectionStatus status = registry.statuses().get(0);
        assertThat(status.lastError()).isEqualTo("timeout");
        assertThat(status.retryCount()).isEqualTo(1);
    }

    @Test
    void shouldMarkDisconnectedAsNotRunning() {
        registry.onStateChanged(change("chat", ConnectionState.CONNECTED, ConnectionState.DISCONNECTED, 0, null));

        assertThat(registry.statuses().get(0).running()).isFalse();
    }

    @Test
    void shouldCountTransitionsPerAdapter() {
        registry.onStateChanged(change("chat", ConnectionState.CONNECTING, ConnectionState.RETRYING, 1, "x"));
        registry.onStateChanged(change("chat", ConnectionState.CONNECTING, ConnectionState.RETRYING, 2, "x"));

        assertThat(meters.get("talkbox.connection.transitions")
                .tag("adapter", "chat").tag("state", "retrying").counter().count()).isEqualTo(2.0);
    }

    @Test
    void shouldLogSummaryWithoutFailing() {
        registry.logSummary();
        registry.onStateChanged(change("chat", ConnectionState.DISCONNECTED, ConnectionState.CONNECTING, 0, null));
        registry.logSummary();

        assertThat(registry.statuses()).hasSize(1);
    }
}
