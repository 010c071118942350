package com.phillippitts.talkbox.service.lifecycle;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One-way "stop requested" flag that background loops poll and wait on.
 *
 * <p>A signal created with {@link #child()} counts as stopped when either it or its parent has been
 * tripped. Connection supervisors use a child of the global signal so one supervisor can be stopped
 * without touching the rest of the system, while a global stop still reaches every one of them.
 *
 * <p><b>Thread Safety:</b> all methods are thread-safe. Waiting threads wake as soon as the signal
 * (or any ancestor) trips.
 */
public final class StopSignal {

    private final StopSignal parent;
    private final List<StopSignal> children = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition tripped = lock.newCondition();
    private volatile boolean stopped;

    public StopSignal() {
        this(null);
    }

    private StopSignal(StopSignal parent) {
        this.parent = parent;
    }

    /** Creates a signal that also observes this one. */
    public StopSignal child() {
        StopSignal c = new StopSignal(this);
        children.add(c);
        return c;
    }

    /**
     * Trips the signal and wakes every waiter, including waiters on child signals.
     *
     * @return true if this call tripped it, false if it was already tripped
     */
    public boolean trip() {
        lock.lock();
        try {
            if (stopped) {
                return false;
            }
            stopped = true;
            tripped.signalAll();
        } finally {
            lock.unlock();
        }
        children.forEach(StopSignal::wakeWaiters);
        return true;
    }

    public boolean isStopped() {
        return stopped || (parent != null && parent.isStopped());
    }

    /**
     * Waits until the signal trips or the timeout elapses, whichever comes first.
     *
     * @param timeout maximum wait
     * @return true if the signal is tripped when the wait ends
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (!isStopped() && remaining > 0) {
                remaining = tripped.awaitNanos(remaining);
            }
            return isStopped();
        } finally {
            lock.unlock();
        }
    }

    private void wakeWaiters() {
        lock.lock();
        try {
            tripped.signalAll();
        } finally {
            lock.unlock();
        }
        children.forEach(StopSignal::wakeWaiters);
    }
}
