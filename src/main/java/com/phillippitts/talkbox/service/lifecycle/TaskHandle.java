package com.phillippitts.talkbox.service.lifecycle;

import java.time.Duration;
import java.util.Optional;

/**
 * Handle to one background task spawned by a {@link TaskGroup}.
 */
public final class TaskHandle {

    private final String name;
    private final Thread thread;
    private volatile Throwable failure;

    TaskHandle(String name, Thread thread) {
        this.name = name;
        this.thread = thread;
    }

    public String name() {
        return name;
    }

    public boolean isAlive() {
        return thread.isAlive();
    }

    /** The exception that ended the task, if it did not exit normally. */
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Waits for the task to finish.
     *
     * @return true if the task has finished
     */
    public boolean join(Duration timeout) throws InterruptedException {
        long millis = Math.max(1, timeout.toMillis());
        thread.join(millis);
        return !thread.isAlive();
    }

    void interrupt() {
        thread.interrupt();
    }

    void recordFailure(Throwable t) {
        this.failure = t;
    }

    Thread thread() {
        return thread;
    }
}
