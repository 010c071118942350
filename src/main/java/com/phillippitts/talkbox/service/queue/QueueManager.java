package com.phillippitts.talkbox.service.queue;

import com.phillippitts.talkbox.domain.IncomingEvent;
import com.phillippitts.talkbox.domain.Priority;
import com.phillippitts.talkbox.domain.QueueItem;
import com.phillippitts.talkbox.domain.Source;
import com.phillippitts.talkbox.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Bounded, priority-aware buffer of pending work between producers (adapters) and the single
 * consumer (the response pipeline).
 *
 * <p><b>Ordering:</b> every admin item is dequeued before any normal item; within a priority class
 * items leave in enqueue order. Two FIFO deques hold the classes, so ordering needs no comparator.
 *
 * <p><b>Capacity:</b> the queue never holds more than {@code maxSize} items in total.
 * <ul>
 *   <li>A normal item arriving at a full queue is rejected.</li>
 *   <li>An admin item arriving at a full queue evicts the oldest normal item.</li>
 *   <li>An admin item arriving at a queue full of admin items is rejected.</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> one {@link ReentrantLock} and one {@link Condition} guard all state, so
 * enqueue and dequeue are atomic with respect to each other. No reference to the internal deques
 * ever leaves this class.
 *
 * <p><b>Stop:</b> after {@link #stop()} new events are rejected, items already accepted can still be
 * dequeued, and {@link #dequeue()} returns empty once the buffer is drained.
 */
public class QueueManager {

    private static final Logger LOG = LogManager.getLogger(QueueManager.class);
    private static final int PREVIEW_CHARS = 40;

    private final int maxSize;
    private final Set<String> adminIds;
    private final LongSupplier nanoTime;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final Deque<QueueItem> adminItems = new ArrayDeque<>();
    private final Deque<QueueItem> normalItems = new ArrayDeque<>();
    private final Set<Source> disabledSources = EnumSet.noneOf(Source.class);

    private boolean closed;
    private boolean paused;
    private long nextSequence = 1;
    private long totalEnqueued;
    private long totalRejected;
    private long totalEvicted;

    public QueueManager(int maxSize, Set<String> adminIds) {
        this(maxSize, adminIds, System::nanoTime, Clock.systemUTC());
    }

    // Package-private for tests that need a controllable monotonic clock
    QueueManager(int maxSize, Set<String> adminIds, LongSupplier nanoTime, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1: " + maxSize);
        }
        this.maxSize = maxSize;
        this.adminIds = Set.copyOf(Objects.requireNonNull(adminIds, "adminIds"));
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
        this.clock = Objects.requireNonNull(clock, "clock");
        LOG.info("Queue manager initialized: maxSize={}, admins={}", maxSize, this.adminIds.size());
    }

    /**
     * Stamps priority and timestamps on the event and adds it to the buffer.
     *
     * @param event producer-supplied event
     * @return accepted (possibly with an evicted normal item) or the rejection reason
     */
    public EnqueueResult enqueue(IncomingEvent event) {
        Objects.requireNonNull(event, "event");
        Priority priority = isAdmin(event.userId()) ? Priority.ADMIN : Priority.NORMAL;

        lock.lock();
        try {
            EnqueueResult.Status rejection = admissionCheck(event, priority);
            if (rejection != null) {
                totalRejected++;
                LOG.debug("Rejected [{}] {}: {} ({})", event.source(), event.userName(),
                        LogSanitizer.preview(event.content(), PREVIEW_CHARS), rejection);
                return EnqueueResult.rejected(rejection);
            }

            QueueItem evicted = null;
            if (size() >= maxSize) {
                // admissionCheck guarantees an admin item and at least one normal item here
                evicted = normalItems.pollFirst();
                totalEvicted++;
                LOG.warn("Queue full ({}); evicted oldest normal item {} from {}",
                        maxSize, evicted.itemId(), evicted.userName());
            }

            QueueItem item = QueueItem.from(event, nextSequence++, priority,
                    nanoTime.getAsLong(), Instant.now(clock));
            (priority == Priority.ADMIN ? adminItems : normalItems).addLast(item);
            totalEnqueued++;
            changed.signalAll();

            LOG.debug("Queued {} [{}] {}: {} (priority={}, size={})", item.itemId(), item.source(),
                    item.userName(), LogSanitizer.preview(item.content(), PREVIEW_CHARS), priority, size());
            return evicted == null
                    ? EnqueueResult.accepted(item)
                    : EnqueueResult.acceptedWithEviction(item, evicted);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until an item is available or the manager is stopped and drained.
     *
     * @return the highest-priority, oldest item, or empty once stopped with nothing left
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public Optional<QueueItem> dequeue() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                if (!paused || closed) {
                    QueueItem next = pollNext();
                    if (next != null) {
                        return Optional.of(next);
                    }
                }
                if (closed && isEmpty()) {
                    return Optional.empty();
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #dequeue()} but gives up after {@code timeout}.
     *
     * @return an item, or empty on timeout or when stopped and drained
     */
    public Optional<QueueItem> dequeue(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (true) {
                if (!paused || closed) {
                    QueueItem next = pollNext();
                    if (next != null) {
                        return Optional.of(next);
                    }
                }
                if ((closed && isEmpty()) || remaining <= 0) {
                    return Optional.empty();
                }
                remaining = changed.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the queue to new events and wakes blocked consumers. Idempotent.
     */
    public void stop() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            changed.signalAll();
            LOG.info("Queue manager stopped; {} item(s) still pending", size());
        } finally {
            lock.unlock();
        }
    }

    public void pause() {
        lock.lock();
        try {
            paused = true;
            LOG.info("Queue paused");
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            paused = false;
            changed.signalAll();
            LOG.info("Queue resumed");
        } finally {
            lock.unlock();
        }
    }

    public void disableSource(Source source) {
        lock.lock();
        try {
            disabledSources.add(Objects.requireNonNull(source, "source"));
            LOG.info("Source {} disabled", source);
        } finally {
            lock.unlock();
        }
    }

    public void enableSource(Source source) {
        lock.lock();
        try {
            disabledSources.remove(Objects.requireNonNull(source, "source"));
            LOG.info("Source {} enabled", source);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every pending item.
     *
     * @return number of items removed
     */
    public int clear() {
        lock.lock();
        try {
            int removed = size();
            adminItems.clear();
            normalItems.clear();
            changed.signalAll();
            LOG.info("Queue cleared: {} item(s) removed", removed);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public boolean isAdmin(String userId) {
        return userId != null && adminIds.contains(userId);
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getSize() {
        lock.lock();
        try {
            return size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Returns true once the queue is stopped and holds nothing. */
    public boolean isDrained() {
        lock.lock();
        try {
            return closed && isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public QueueSnapshot snapshot() {
        lock.lock();
        try {
            return new QueueSnapshot(size(), maxSize, adminItems.size(), normalItems.size(), paused, closed,
                    disabledSources, totalEnqueued, totalRejected, totalEvicted);
        } finally {
            lock.unlock();
        }
    }

    /** Returns a rejection status, or null when the event may be added. Caller holds the lock. */
    private EnqueueResult.Status admissionCheck(IncomingEvent event, Priority priority) {
        if (closed) {
            return EnqueueResult.Status.REJECTED_CLOSED;
        }
        if (paused) {
            return EnqueueResult.Status.REJECTED_PAUSED;
        }
        if (disabledSources.contains(event.source())) {
            return EnqueueResult.Status.REJECTED_SOURCE_DISABLED;
        }
        if (size() >= maxSize && (priority == Priority.NORMAL || normalItems.isEmpty())) {
            return EnqueueResult.Status.REJECTED_FULL;
        }
        return null;
    }

    private QueueItem pollNext() {
        QueueItem next = adminItems.pollFirst();
        if (next == null) {
            next = normalItems.pollFirst();
        }
        if (next != null) {
            changed.signalAll();
        }
        return next;
    }

    private int size() {
        return adminItems.size() + normalItems.size();
    }

    private boolean isEmpty() {
        return adminItems.isEmpty() && normalItems.isEmpty();
    }
}
