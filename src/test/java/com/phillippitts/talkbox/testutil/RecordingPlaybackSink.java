package com.phillippitts.talkbox.testutil;

import com.phillippitts.talkbox.exception.PlaybackException;
import com.phillippitts.talkbox.service.audio.playback.PlaybackSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Playback sink that records buffers. Can fail on demand, or hold playback open until released
 * to simulate a long reply.
 */
public class RecordingPlaybackSink implements PlaybackSink {

    private final List<float[]> played = new CopyOnWriteArrayList<>();
    private final CountDownLatch started = new CountDownLatch(1);
    private volatile CountDownLatch release;
    private volatile boolean failing;
    private volatile boolean interrupted;

    @Override
    public void play(float[] samples, int sampleRate) {
        started.countDown();
        CountDownLatch gate = release;
        if (gate != null) {
            try {
                if (!gate.await(10, TimeUnit.SECONDS)) {
                    throw new PlaybackException("test playback gate never opened");
                }
            } catch (InterruptedException e) {
                interrupted = true;
                Thread.currentThread().interrupt();
                throw new PlaybackException("interrupted", e);
            }
        }
        if (failing) {
            throw new PlaybackException("device unplugged");
        }
        played.add(samples.clone());
    }

    /** Makes the next play() calls block until {@link #releasePlayback()}. */
    public void holdPlayback() {
        release = new CountDownLatch(1);
    }

    public void releasePlayback() {
        CountDownLatch gate = release;
        if (gate != null) {
            gate.countDown();
        }
    }

    public boolean awaitPlaybackStarted(long timeoutMs) throws InterruptedException {
        return started.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public boolean wasInterrupted() {
        return interrupted;
    }

    public List<float[]> played() {
        return List.copyOf(played);
    }
}
