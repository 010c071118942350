package com.phillippitts.talkbox.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work held by the queue and processed by the response pipeline.
 *
 * <p>Instances are created only by the queue manager, which assigns {@code sequence},
 * {@code priority} and both timestamps. {@code enqueuedAtNanos} is monotonic and is used for
 * staleness checks; {@code receivedAt} is wall-clock time for logs and status output.
 */
public record QueueItem(
        long sequence,
        String content,
        Source source,
        String userId,
        String userName,
        Priority priority,
        long enqueuedAtNanos,
        Instant receivedAt,
        Map<String, Object> metadata
) {
    public QueueItem {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(receivedAt, "receivedAt");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static QueueItem from(IncomingEvent event, long sequence, Priority priority,
                                 long enqueuedAtNanos, Instant receivedAt) {
        return new QueueItem(sequence, event.content(), event.source(), event.userId(), event.userName(),
                priority, enqueuedAtNanos, receivedAt, event.metadata());
    }

    public boolean isAdmin() {
        return priority == Priority.ADMIN;
    }

    /** Short identifier used in logs and MDC. */
    public String itemId() {
        return "item-" + sequence;
    }
}
