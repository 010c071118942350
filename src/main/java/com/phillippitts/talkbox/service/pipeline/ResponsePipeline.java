package com.phillippitts.talkbox.service.pipeline;

import com.phillippitts.talkbox.config.properties.PipelineProperties;
import com.phillippitts.talkbox.domain.QueueItem;
import com.phillippitts.talkbox.domain.ReplyResult;
import com.phillippitts.talkbox.domain.SynthesizedAudio;
import com.phillippitts.talkbox.service.audio.playback.PlaybackSink;
import com.phillippitts.talkbox.service.avatar.AvatarController;
import com.phillippitts.talkbox.service.lifecycle.StopSignal;
import com.phillippitts.talkbox.service.metrics.PipelineMetrics;
import com.phillippitts.talkbox.service.pipeline.event.ItemProcessedEvent;
import com.phillippitts.talkbox.service.queue.QueueManager;
import com.phillippitts.talkbox.service.reply.ReplyGenerator;
import com.phillippitts.talkbox.service.tts.SpeechSynthesizer;
import com.phillippitts.talkbox.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Single consumer of the queue: turns one item at a time into spoken output.
 *
 * <p><b>Stages:</b> generate reply, synthesize speech, post-process audio, then play it while the
 * avatar shows the talking animation. Any stage failure aborts only the current item; the loop
 * moves straight on to the next one.
 *
 * <p><b>Single-flight:</b> at most one item is in {@link #process(QueueItem)} at any instant. A second
 * concurrent call fails with {@link IllegalStateException} instead of queuing behind the first.
 *
 * <p><b>Shutdown:</b> items dequeued after the stop signal trips are {@link ItemOutcome#ABANDONED}.
 * An item already past its first stage runs to completion, so a reply that is playing finishes.
 *
 * <p>Log4j2 ThreadContext carries {@code itemId}, {@code source} and {@code userId} while an item is
 * in flight.
 */
public class ResponsePipeline {

    private static final Logger LOG = LogManager.getLogger(ResponsePipeline.class);
    private static final int PREVIEW_CHARS = 60;

    private final QueueManager queue;
    private final PipelineCollaborators collaborators;
    private final PipelineProperties props;
    private final StopSignal stopSignal;
    private final PipelineMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final LongSupplier nanoTime;
    private final Clock clock;

    private final AtomicReference<PipelineRunContext> inFlight = new AtomicReference<>();
    private final Map<ItemOutcome, AtomicLong> outcomeCounts = new EnumMap<>(ItemOutcome.class);
    private final AtomicReference<Duration> lastProcessingTime = new AtomicReference<>();
    private final AtomicReference<Instant> lastFinishedAt = new AtomicReference<>();

    private volatile boolean avatarConnected;

    public ResponsePipeline(QueueManager queue,
                            PipelineCollaborators collaborators,
                            PipelineProperties props,
                            StopSignal stopSignal,
                            PipelineMetrics metrics,
                            ApplicationEventPublisher publisher) {
        this(queue, collaborators, props, stopSignal, metrics, publisher, System::nanoTime, Clock.systemUTC());
    }

    // Package-private for tests that control item age
    ResponsePipeline(QueueManager queue,
                     PipelineCollaborators collaborators,
                     PipelineProperties props,
                     StopSignal stopSignal,
                     PipelineMetrics metrics,
                     ApplicationEventPublisher publisher,
                     LongSupplier nanoTime,
                     Clock clock) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
        this.props = Objects.requireNonNull(props, "props");
        this.stopSignal = Objects.requireNonNull(stopSignal, "stopSignal");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (ItemOutcome o : ItemOutcome.values()) {
            outcomeCounts.put(o, new AtomicLong());
        }
    }

    /**
     * Consumer loop. Returns once the queue is stopped and drained, or when the thread is interrupted.
     */
    public void run() {
        LOG.info("Response pipeline started");
        try {
            while (true) {
                Optional<QueueItem> next = queue.dequeue();
                if (next.isEmpty()) {
                    break;
                }
                try {
                    process(next.get());
                } catch (RuntimeException e) {
                    LOG.error("Unexpected pipeline failure for {}; continuing", next.get().itemId(), e);
                }
            }
            LOG.info("Response pipeline stopped: queue drained");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Response pipeline interrupted; exiting");
        }
    }

    /**
     * Drives one item through every stage.
     *
     * @param item dequeued item
     * @return how the item finished
     * @throws IllegalStateException if another item is already in flight
     */
    public ItemOutcome process(QueueItem item) {
        Objects.requireNonNull(item, "item");
        PipelineRunContext ctx = new PipelineRunContext(item, nanoTime.getAsLong());
        if (!inFlight.compareAndSet(null, ctx)) {
            throw new IllegalStateException("Pipeline busy with " + inFlight.get().item().itemId()
                    + "; cannot start " + item.itemId());
        }
        ThreadContext.put("itemId", item.itemId());
        ThreadContext.put("source", item.source().wireName());
        ThreadContext.put("userId", item.userId());
        ItemOutcome outcome = null;
        try {
            outcome = runStages(ctx);
            return outcome;
        } finally {
            inFlight.set(null);
            if (outcome != null) {
                finish(ctx, outcome);
            }
            ThreadContext.remove("itemId");
            ThreadContext.remove("source");
            ThreadContext.remove("userId");
        }
    }

    /** The item currently in flight, if any. */
    public Optional<PipelineRunContext> currentRun() {
        return Optional.ofNullable(inFlight.get());
    }

    /**
     * Requests cancellation of the in-flight item. Takes effect at the next stage boundary.
     *
     * @return the cancelled item's id, or empty when the pipeline is idle
     */
    public Optional<String> cancelCurrent() {
        PipelineRunContext ctx = inFlight.get();
        if (ctx == null) {
            return Optional.empty();
        }
        ctx.cancel();
        LOG.info("Cancellation requested for {}", ctx.item().itemId());
        return Optional.of(ctx.item().itemId());
    }

    /** Enables or disables the avatar talking signal; set by the lifecycle coordinator. */
    public void setAvatarConnected(boolean connected) {
        this.avatarConnected = connected;
    }

    public PipelineStats stats() {
        long processed = outcomeCounts.values().stream().mapToLong(AtomicLong::get).sum();
        PipelineRunContext ctx = inFlight.get();
        return new PipelineStats(
                processed,
                outcomeCounts.get(ItemOutcome.COMPLETED).get(),
                outcomeCounts.get(ItemOutcome.SUPPRESSED).get(),
                outcomeCounts.get(ItemOutcome.ABORTED).get(),
                outcomeCounts.get(ItemOutcome.SKIPPED_STALE).get(),
                outcomeCounts.get(ItemOutcome.ABANDONED).get(),
                lastProcessingTime.get(),
                lastFinishedAt.get(),
                ctx == null ? null : ctx.item().itemId());
    }

    private ItemOutcome runStages(PipelineRunContext ctx) {
        QueueItem item = ctx.item();

        if (stopSignal.isStopped()) {
            LOG.debug("Stop requested; abandoning {}", item.itemId());
            return ItemOutcome.ABANDONED;
        }
        if (isStale(item, ctx.startedAtNanos())) {
            LOG.info("Skipping stale {} from {} (waited longer than {}ms)",
                    item.itemId(), item.userName(), props.getMaxItemAge().toMillis());
            return ItemOutcome.SKIPPED_STALE;
        }

        LOG.info("Processing {} [{}] {}: {}", item.itemId(), item.source(), item.userName(),
                LogSanitizer.preview(item.content(), PREVIEW_CHARS));

        // Generate
        if (!enter(ctx, PipelineStage.GENERATING)) {
            return ItemOutcome.ABORTED;
        }
        Optional<ReplyGenerator> generator = collaborators.replyGenerator();
        if (generator.isEmpty()) {
            return abort(ctx, "no reply generator configured");
        }
        ReplyResult reply;
        long t0 = nanoTime.getAsLong();
        try {
            reply = generator.get().generate(item.content(), item.userName(), item.source());
        } catch (RuntimeException e) {
            return abort(ctx, "reply generation failed: " + e.getMessage());
        } finally {
            metrics.recordStageLatency(PipelineStage.GENERATING, nanoTime.getAsLong() - t0);
        }
        if (reply == null) {
            return abort(ctx, "reply generator returned no result");
        }
        if (reply.isSuppressed()) {
            LOG.info("Reply suppressed for {}: {}", item.itemId(), reply.reason());
            ctx.advance(PipelineStage.DONE);
            return ItemOutcome.SUPPRESSED;
        }
        ctx.setReplyText(reply.replyText());
        LOG.debug("Reply for {}: {}", item.itemId(), LogSanitizer.preview(reply.replyText(), PREVIEW_CHARS));

        // Synthesize
        if (!enter(ctx, PipelineStage.SYNTHESIZING)) {
            return ItemOutcome.ABORTED;
        }
        Optional<SpeechSynthesizer> synthesizer = collaborators.speechSynthesizer();
        if (synthesizer.isEmpty()) {
            return abort(ctx, "no speech synthesizer configured");
        }
        if (!synthesizer.get().isAvailable()) {
            return abort(ctx, "speech synthesizer " + synthesizer.get().name() + " unavailable");
        }
        SynthesizedAudio audio;
        t0 = nanoTime.getAsLong();
        try {
            audio = synthesizer.get().synthesize(reply.replyText());
        } catch (RuntimeException e) {
            return abort(ctx, "speech synthesis failed: " + e.getMessage());
        } finally {
            metrics.recordStageLatency(PipelineStage.SYNTHESIZING, nanoTime.getAsLong() - t0);
        }
        if (audio == null) {
            return abort(ctx, "speech synthesizer returned no audio");
        }
        ctx.setSynthesizedAudio(audio);

        // Post-process
        if (!enter(ctx, PipelineStage.POST_PROCESSING)) {
            return ItemOutcome.ABORTED;
        }
        t0 = nanoTime.getAsLong();
        try {
            ctx.setProcessedSamples(collaborators.postProcessor().process(audio.samples(), audio.sampleRate()));
        } catch (RuntimeException e) {
            return abort(ctx, "audio post-processing failed: " + e.getMessage());
        } finally {
            metrics.recordStageLatency(PipelineStage.POST_PROCESSING, nanoTime.getAsLong() - t0);
        }

        // Play
        if (!enter(ctx, PipelineStage.PLAYING)) {
            return ItemOutcome.ABORTED;
        }
        Optional<PlaybackSink> sink = collaborators.playbackSink();
        if (sink.isEmpty()) {
            return abort(ctx, "no playback sink configured");
        }
        t0 = nanoTime.getAsLong();
        setTalking(true);
        try {
            sink.get().play(ctx.processedSamples(), audio.sampleRate());
        } catch (RuntimeException e) {
            return abort(ctx, "playback failed: " + e.getMessage());
        } finally {
            setTalking(false);
            metrics.recordStageLatency(PipelineStage.PLAYING, nanoTime.getAsLong() - t0);
        }

        ctx.advance(PipelineStage.DONE);
        return ItemOutcome.COMPLETED;
    }

    /** Moves to the next stage unless the item was cancelled. */
    private boolean enter(PipelineRunContext ctx, PipelineStage stage) {
        if (ctx.isCancelled()) {
            abort(ctx, "cancelled before " + stage);
            return false;
        }
        ctx.advance(stage);
        return true;
    }

    private ItemOutcome abort(PipelineRunContext ctx, String reason) {
        LOG.warn("Aborting {} at {}: {}", ctx.item().itemId(), ctx.stage(), reason);
        ctx.abort(reason);
        return ItemOutcome.ABORTED;
    }

    private boolean isStale(QueueItem item, long nowNanos) {
        if (!props.isStalenessCheckEnabled()) {
            return false;
        }
        return nowNanos - item.enqueuedAtNanos() > props.getMaxItemAge().toNanos();
    }

    private void setTalking(boolean talking) {
        Optional<AvatarController> avatar = collaborators.avatarController();
        if (!avatarConnected || avatar.isEmpty()) {
            return;
        }
        try {
            avatar.get().setTalking(talking);
        } catch (RuntimeException e) {
            LOG.debug("Avatar setTalking({}) failed: {}", talking, e.toString());
        }
    }

    private void finish(PipelineRunContext ctx, ItemOutcome outcome) {
        Duration elapsed = Duration.ofNanos(nanoTime.getAsLong() - ctx.startedAtNanos());
        Instant now = Instant.now(clock);
        outcomeCounts.get(outcome).incrementAndGet();
        lastProcessingTime.set(elapsed);
        lastFinishedAt.set(now);
        metrics.recordOutcome(outcome);

        String reason = switch (outcome) {
            case ABORTED -> ctx.abortReason().orElse(null);
            case SKIPPED_STALE -> "stale";
            case ABANDONED -> "shutdown";
            default -> null;
        };
        LOG.info("Finished {} with {} in {}ms", ctx.item().itemId(), outcome, elapsed.toMillis());
        try {
            publisher.publishEvent(new ItemProcessedEvent(
                    ctx.item().itemId(),
                    ctx.item().source(),
                    ctx.item().userId(),
                    outcome,
                    ctx.failedStage().orElse(null),
                    reason,
                    elapsed,
                    now));
        } catch (RuntimeException e) {
            LOG.warn("ItemProcessedEvent listener failed for {}: {}", ctx.item().itemId(), e.toString());
        }
    }
}
