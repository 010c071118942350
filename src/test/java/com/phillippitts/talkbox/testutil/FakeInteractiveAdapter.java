package com.phillippitts.talkbox.testutil;

import com.phillippitts.talkbox.domain.Source;
import com.phillippitts.talkbox.service.adapter.InteractiveAdapter;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapter whose sessions fail a configurable number of times, then stay connected until stopped.
 */
public class FakeInteractiveAdapter implements InteractiveAdapter {

    private final String name;
    private final Set<Source> sources;
    private final AtomicInteger failuresLeft;
    private final AtomicInteger starts = new AtomicInteger();
    private final AtomicInteger stops = new AtomicInteger();
    private final List<String> feedback = new CopyOnWriteArrayList<>();
    private volatile CountDownLatch stopped = new CountDownLatch(1);
    private volatile boolean failStop;

    public FakeInteractiveAdapter(String name, Set<Source> sources, int failuresBeforeConnect) {
        this.name = name;
        this.sources = Set.copyOf(sources);
        this.failuresLeft = new AtomicInteger(failuresBeforeConnect);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<Source> sources() {
        return sources;
    }

    @Override
    public void start(Runnable onConnected) throws Exception {
        starts.incrementAndGet();
        if (failuresLeft.getAndDecrement() > 0) {
            throw new IllegalStateException("connection refused");
        }
        onConnected.run();
        stopped.await();
    }

    @Override
    public void stop() throws Exception {
        stops.incrementAndGet();
        stopped.countDown();
        if (failStop) {
            throw new IllegalStateException("stop failed");
        }
    }

    @Override
    public void sendFeedback(String userId, String message) {
        feedback.add(userId + ": " + message);
    }

    public void setFailStop(boolean failStop) {
        this.failStop = failStop;
    }

    public boolean awaitStopped(long timeoutMs) throws InterruptedException {
        return stopped.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public int starts() {
        return starts.get();
    }

    public int stops() {
        return stops.get();
    }

    public List<String> feedback() {
        return List.copyOf(feedback);
    }
}
