package com.phillippitts.talkbox.service.queue;

import com.phillippitts.talkbox.domain.Source;

import java.util.Set;

/**
 * Point-in-time copy of queue state for status endpoints, admin commands and health checks.
 */
public record QueueSnapshot(
        int size,
        int capacity,
        int adminCount,
        int normalCount,
        boolean paused,
        boolean closed,
        Set<Source> disabledSources,
        long totalEnqueued,
        long totalRejected,
        long totalEvicted
) {
    public QueueSnapshot {
        disabledSources = Set.copyOf(disabledSources);
    }

    public boolean isFull() {
        return size >= capacity;
    }
}
