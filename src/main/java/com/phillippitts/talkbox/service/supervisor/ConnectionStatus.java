package com.phillippitts.talkbox.service.supervisor;

import java.time.Instant;

/**
 * Immutable snapshot of a supervisor for status output and health checks.
 *
 * @param name adapter name
 * @param state current state
 * @param retryCount failures since the supervisor started
 * @param lastError message of the most recent failure, or null
 * @param since when the current state was entered
 * @param running whether the supervisor loop is still active
 */
public record ConnectionStatus(
        String name,
        ConnectionState state,
        int retryCount,
        String lastError,
        Instant since,
        boolean running
) {}
