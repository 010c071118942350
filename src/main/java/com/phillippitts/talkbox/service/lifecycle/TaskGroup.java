package com.phillippitts.talkbox.service.lifecycle;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns every long-running background task so they can be cancelled and joined as one unit.
 *
 * <p>Each task runs on its own named daemon thread. The spawning thread's Log4j2 ThreadContext is
 * copied to the task, and the task name is added under the {@code task} key.
 *
 * <p><b>Cancellation</b> is two-phase:
 * <ol>
 *   <li>Wait up to the grace period for tasks to exit on their own (they watch the stop signal)</li>
 *   <li>Interrupt the stragglers and wait briefly for them to acknowledge</li>
 * </ol>
 * Task failures are recorded on the {@link TaskHandle} and logged; they never propagate to the
 * caller of {@link #cancelAll(Duration)}.
 */
public class TaskGroup {

    private static final Logger LOG = LogManager.getLogger(TaskGroup.class);

    static final Duration INTERRUPT_ACK_TIMEOUT = Duration.ofSeconds(2);
    private static final String THREAD_PREFIX = "talkbox-";

    private final List<TaskHandle> tasks = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    /**
     * Starts a task.
     *
     * @param name short name used in the thread name and logs
     * @param body task body; should return when the stop signal trips or the thread is interrupted
     * @return handle to the running task
     * @throws IllegalStateException if the group was already cancelled
     */
    public TaskHandle spawn(String name, Runnable body) {
        if (closed) {
            throw new IllegalStateException("Task group is cancelled; cannot spawn " + name);
        }
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        TaskHandle[] self = new TaskHandle[1];
        Thread t = new Thread(() -> {
            try {
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                ThreadContext.put("task", name);
                LOG.debug("Task {} started", name);
                body.run();
                LOG.debug("Task {} finished", name);
            } catch (Throwable ex) {
                self[0].recordFailure(ex);
                LOG.error("Task {} failed", name, ex);
            } finally {
                ThreadContext.clearAll();
            }
        }, THREAD_PREFIX + name);
        t.setDaemon(true);
        TaskHandle handle = new TaskHandle(name, t);
        self[0] = handle;
        tasks.add(handle);
        t.start();
        return handle;
    }

    /**
     * Cancels the group: no more spawns, cooperative wait, then interrupts. Idempotent.
     *
     * @param grace how long tasks may take to exit on their own
     * @return what happened to each task
     */
    public CancelSummary cancelAll(Duration grace) {
        closed = true;
        long deadline = System.nanoTime() + grace.toNanos();
        List<String> interrupted = new ArrayList<>();
        List<String> unresponsive = new ArrayList<>();

        for (TaskHandle handle : tasks) {
            long remaining = deadline - System.nanoTime();
            if (remaining > 0 && joinQuietly(handle, Duration.ofNanos(remaining))) {
                continue;
            }
            if (handle.isAlive()) {
                LOG.warn("Task {} did not exit within {}ms; interrupting", handle.name(), grace.toMillis());
                handle.interrupt();
                interrupted.add(handle.name());
            }
        }
        for (TaskHandle handle : tasks) {
            if (interrupted.contains(handle.name()) && !joinQuietly(handle, INTERRUPT_ACK_TIMEOUT)) {
                LOG.warn("Task {} did not acknowledge interrupt within {}ms",
                        handle.name(), INTERRUPT_ACK_TIMEOUT.toMillis());
                unresponsive.add(handle.name());
            }
        }
        return new CancelSummary(tasks.size(), interrupted, unresponsive);
    }

    public boolean isCancelled() {
        return closed;
    }

    /** Snapshot of spawned tasks, running or finished. */
    public List<TaskHandle> tasks() {
        return List.copyOf(tasks);
    }

    private boolean joinQuietly(TaskHandle handle, Duration timeout) {
        if (handle.thread() == Thread.currentThread()) {
            return false;
        }
        try {
            return handle.join(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for task {}", handle.name());
            return !handle.isAlive();
        }
    }

    /**
     * Result of {@link #cancelAll(Duration)}.
     *
     * @param total tasks ever spawned in this group
     * @param interrupted tasks that had to be interrupted after the grace period
     * @param unresponsive tasks still alive after the interrupt
     */
    public record CancelSummary(int total, List<String> interrupted, List<String> unresponsive) {
        public CancelSummary {
            interrupted = List.copyOf(interrupted);
            unresponsive = List.copyOf(unresponsive);
        }

        public boolean isClean() {
            return unresponsive.isEmpty();
        }
    }
}
