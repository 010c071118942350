package com.phillippitts.talkbox.service.pipeline;

import com.phillippitts.talkbox.domain.QueueItem;
import com.phillippitts.talkbox.domain.SynthesizedAudio;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of the single item currently in the pipeline.
 *
 * <p>Only the pipeline thread mutates it; other threads may read the stage and request
 * cancellation, which takes effect at the next stage boundary.
 */
public final class PipelineRunContext {

    private final QueueItem item;
    private final long startedAtNanos;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile PipelineStage stage = PipelineStage.QUEUED;
    private volatile PipelineStage failedStage;
    private volatile String abortReason;
    private volatile String replyText;
    private volatile SynthesizedAudio synthesizedAudio;
    private volatile float[] processedSamples;

    PipelineRunContext(QueueItem item, long startedAtNanos) {
        this.item = Objects.requireNonNull(item, "item");
        this.startedAtNanos = startedAtNanos;
    }

    public QueueItem item() {
        return item;
    }

    public PipelineStage stage() {
        return stage;
    }

    public long startedAtNanos() {
        return startedAtNanos;
    }

    public Optional<String> abortReason() {
        return Optional.ofNullable(abortReason);
    }

    /** Stage that was running when the item aborted. */
    public Optional<PipelineStage> failedStage() {
        return Optional.ofNullable(failedStage);
    }

    public Optional<String> replyText() {
        return Optional.ofNullable(replyText);
    }

    public Optional<SynthesizedAudio> synthesizedAudio() {
        return Optional.ofNullable(synthesizedAudio);
    }

    /** Requests cancellation; honored before the next stage starts. */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void advance(PipelineStage next) {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Item " + item.itemId() + " already " + stage);
        }
        this.stage = next;
    }

    void abort(String reason) {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Item " + item.itemId() + " already " + stage);
        }
        this.failedStage = stage;
        this.abortReason = reason;
        this.stage = PipelineStage.ABORTED;
    }

    void setReplyText(String replyText) {
        this.replyText = replyText;
    }

    void setSynthesizedAudio(SynthesizedAudio audio) {
        this.synthesizedAudio = audio;
    }

    void setProcessedSamples(float[] samples) {
        this.processedSamples = samples;
    }

    float[] processedSamples() {
        return processedSamples;
    }
}
