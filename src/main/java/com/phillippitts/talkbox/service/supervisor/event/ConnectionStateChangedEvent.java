package com.phillippitts.talkbox.service.supervisor.event;

import com.phillippitts.talkbox.service.supervisor.ConnectionState;

import java.time.Instant;

/**
 * Published on every supervisor state change.
 *
 * @param name adapter name
 * @param previous state before the change
 * @param current state after the change
 * @param retryCount failures so far
 * @param error failure message when entering RETRYING, otherwise null
 * @param at when the change happened
 */
public record ConnectionStateChangedEvent(
        String name,
        ConnectionState previous,
        ConnectionState current,
        int retryCount,
        String error,
        Instant at
) {}
