package com.phillippitts.talkbox.service.supervisor;

import com.phillippitts.talkbox.service.lifecycle.StopSignal;
import com.phillippitts.talkbox.service.supervisor.event.ConnectionStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps one flaky external connection alive with a fixed-backoff retry loop.
 *
 * <p>Loop model:
 * <ul>
 *   <li>Call {@link SupervisedConnection#connectAndRun(Runnable)}; state CONNECTING, then CONNECTED
 *       once the connection reports it is live.</li>
 *   <li>A normal return means the session ended cleanly; the supervisor exits.</li>
 *   <li>An exception is recorded (retry count, last error), the state becomes RETRYING and the
 *       supervisor waits the fixed backoff interval before trying again.</li>
 *   <li>The backoff wait ends early when the stop signal trips, so the supervisor stops within one
 *       interval. Interruption also ends the loop.</li>
 * </ul>
 *
 * <p>A failure never escapes {@link #run()}; a bad connection cannot take the process down.
 */
public class ConnectionSupervisor {

    private static final Logger LOG = LogManager.getLogger(ConnectionSupervisor.class);

    private final String name;
    private final SupervisedConnection connection;
    private final Duration backoffInterval;
    private final StopSignal stopSignal;
    private final ApplicationEventPublisher publisher;

    private final ReentrantLock stateLock = new ReentrantLock();
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private Instant since = Instant.now();
    private int retryCount;
    private String lastError;
    private volatile boolean running;

    /**
     * @param name adapter name for logs and status
     * @param connection the connection to keep alive
     * @param backoffInterval fixed wait between attempts; must be positive
     * @param globalStop system-wide stop signal; the supervisor observes a child of it
     * @param publisher receives {@link ConnectionStateChangedEvent}s
     */
    public ConnectionSupervisor(String name,
                                SupervisedConnection connection,
                                Duration backoffInterval,
                                StopSignal globalStop,
                                ApplicationEventPublisher publisher) {
        this.name = Objects.requireNonNull(name, "name");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.backoffInterval = Objects.requireNonNull(backoffInterval, "backoffInterval");
        if (backoffInterval.isNegative() || backoffInterval.isZero()) {
            throw new IllegalArgumentException("backoffInterval must be positive: " + backoffInterval);
        }
        this.stopSignal = Objects.requireNonNull(globalStop, "globalStop").child();
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /** Supervisor loop. Blocks until stopped, interrupted, or the connection ends cleanly. */
    public void run() {
        running = true;
        LOG.info("Supervisor {} started (backoff={}ms)", name, backoffInterval.toMillis());
        try {
            while (!stopSignal.isStopped()) {
                transition(ConnectionState.CONNECTING, null);
                try {
                    connection.connectAndRun(this::onConnected);
                    LOG.info("{} session ended normally", name);
                    break;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.info("{} interrupted while connected", name);
                    break;
                } catch (Exception e) {
                    if (stopSignal.isStopped()) {
                        LOG.debug("{} failed during stop: {}", name, e.toString());
                        break;
                    }
                    recordFailure(e);
                }
                try {
                    if (stopSignal.await(backoffInterval)) {
                        break;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.info("{} interrupted during backoff", name);
                    break;
                }
                LOG.info("Retrying {} (attempt {})", name, retryCount + 1);
            }
        } finally {
            running = false;
            transition(ConnectionState.DISCONNECTED, null);
            LOG.info("Supervisor {} stopped after {} failure(s)", name, getRetryCount());
        }
    }

    /** Stops this supervisor only; wakes it if it is waiting out a backoff. */
    public void requestStop() {
        if (stopSignal.trip()) {
            LOG.info("Stop requested for supervisor {}", name);
        }
    }

    public String getName() {
        return name;
    }

    public boolean isRunning() {
        return running;
    }

    public ConnectionState getState() {
        stateLock.lock();
        try {
            return state;
        } finally {
            stateLock.unlock();
        }
    }

    public int getRetryCount() {
        stateLock.lock();
        try {
            return retryCount;
        } finally {
            stateLock.unlock();
        }
    }

    public ConnectionStatus status() {
        stateLock.lock();
        try {
            return new ConnectionStatus(name, state, retryCount, lastError, since, running);
        } finally {
            stateLock.unlock();
        }
    }

    private void onConnected() {
        transition(ConnectionState.CONNECTED, null);
        LOG.info("{} connected", name);
    }

    private void recordFailure(Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        stateLock.lock();
        try {
            retryCount++;
            lastError = message;
        } finally {
            stateLock.unlock();
        }
        LOG.warn("{} connection failed: {}; retrying in {}ms", name, message, backoffInterval.toMillis());
        LOG.debug("{} failure detail", name, e);
        transition(ConnectionState.RETRYING, message);
    }

    private void transition(ConnectionState next, String error) {
        ConnectionState previous;
        int retries;
        Instant now = Instant.now();
        stateLock.lock();
        try {
            previous = state;
            if (previous == next) {
                return;
            }
            state = next;
            since = now;
            retries = retryCount;
        } finally {
            stateLock.unlock();
        }
        try {
            publisher.publishEvent(new ConnectionStateChangedEvent(name, previous, next, retries, error, now));
        } catch (RuntimeException ex) {
            LOG.warn("ConnectionStateChangedEvent listener failed for {}: {}", name, ex.toString());
        }
    }
}
