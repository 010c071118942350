package com.phillippitts.talkbox.service.queue;

import com.phillippitts.talkbox.domain.QueueItem;

import java.util.Optional;

/**
 * Outcome of {@link QueueManager#enqueue}. Rejections are results, not exceptions.
 *
 * @param status what happened to the incoming event
 * @param item the queued item when accepted, otherwise {@code null}
 * @param evicted the normal item dropped to make room for an admin item, otherwise {@code null}
 */
public record EnqueueResult(Status status, QueueItem item, QueueItem evicted) {

    public enum Status {
        ACCEPTED,
        ACCEPTED_EVICTED_OLDEST,
        REJECTED_FULL,
        REJECTED_CLOSED,
        REJECTED_PAUSED,
        REJECTED_SOURCE_DISABLED
    }

    static EnqueueResult accepted(QueueItem item) {
        return new EnqueueResult(Status.ACCEPTED, item, null);
    }

    static EnqueueResult acceptedWithEviction(QueueItem item, QueueItem evicted) {
        return new EnqueueResult(Status.ACCEPTED_EVICTED_OLDEST, item, evicted);
    }

    static EnqueueResult rejected(Status status) {
        return new EnqueueResult(status, null, null);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED || status == Status.ACCEPTED_EVICTED_OLDEST;
    }

    public Optional<QueueItem> queuedItem() {
        return Optional.ofNullable(item);
    }

    public Optional<QueueItem> evictedItem() {
        return Optional.ofNullable(evicted);
    }
}
