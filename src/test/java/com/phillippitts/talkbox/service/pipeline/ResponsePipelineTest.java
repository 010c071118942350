package com.phillippitts.talkbox.service.pipeline;

import com.phillippitts.talkbox.config.properties.PipelineProperties;
import com.phillippitts.talkbox.domain.IncomingEvent;
import com.phillippitts.talkbox.domain.Priority;
import com.phillippitts.talkbox.domain.QueueItem;
import com.phillippitts.talkbox.domain.ReplyResult;
import com.phillippitts.talkbox.domain.Source;
import com.phillippitts.talkbox.service.audio.AudioPostProcessor;
import com.phillippitts.talkbox.service.audio.playback.PlaybackSink;
import com.phillippitts.talkbox.service.lifecycle.StopSignal;
import com.phillippitts.talkbox.service.metrics.PipelineMetrics;
import com.phillippitts.talkbox.service.pipeline.event.ItemProcessedEvent;
import com.phillippitts.talkbox.service.queue.QueueManager;
import com.phillippitts.talkbox.service.reply.ReplyGenerator;
import com.phillippitts.talkbox.testutil.EventCapturingPublisher;
import com.phillippitts.talkbox.testutil.FakeAvatarController;
import com.phillippitts.talkbox.testutil.FakeReplyGenerator;
import com.phillippitts.talkbox.testutil.FakeSpeechSynthesizer;
import com.phillippitts.talkbox.testutil.RecordingPlaybackSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ResponsePipelineTest {

    private QueueManager queue;
    private FakeReplyGenerator generator;
    private FakeSpeechSynthesizer synthesizer;
    private RecordingPlaybackSink sink;
    private FakeAvatarController avatar;
    private StopSignal stopSignal;
    private SimpleMeterRegistry registry;
    private EventCapturingPublisher publisher;

    @BeforeEach
    void setUp() {
        queue = new QueueManager(10, Set.of());
        generator = new FakeReplyGenerator();
        synthesizer = new FakeSpeechSynthesizer();
        sink = new RecordingPlaybackSink();
        avatar = new FakeAvatarController();
        stopSignal = new StopSignal();
        registry = new SimpleMeterRegistry();
        publisher = new EventCapturingPublisher();
    }

    private ResponsePipeline pipeline(ReplyGenerator gen, PlaybackSink playback) {
        PipelineCollaborators collaborators = new PipelineCollaborators(
                gen, synthesizer, new AudioPostProcessor(), playback, avatar);
        return new ResponsePipeline(queue, collaborators, new PipelineProperties(), stopSignal,
                new PipelineMetrics(registry, queue), publisher);
    }

    private ResponsePipeline pipeline() {
        return pipeline(generator, sink);
    }

    private static QueueItem item(long seq, String content) {
        return new QueueItem(seq, content, Source.TEXT, "user-" + seq, "Viewer" + seq, Priority.NORMAL,
                System.nanoTime(), Instant.now(), Map.of());
    }

    private List<ItemProcessedEvent> processed() {
        return publisher.eventsOfType(ItemProcessedEvent.class);
    }

    @Test
    void shouldPlayNormalizedReplyWhileAvatarTalks() {
        // Arrange
        ResponsePipeline pipeline = pipeline();
        pipeline.setAvatarConnected(true);

        // Act
        ItemOutcome outcome = pipeline.process(item(1, "hello"));

        // Assert
        assertThat(outcome).isEqualTo(ItemOutcome.COMPLETED);
        assertThat(generator.prompts()).containsExactly("hello");
        assertThat(sink.played()).hasSize(1);
        float peak = 0;
        for (float s : sink.played().get(0)) {
            peak = Math.max(peak, Math.abs(s));
        }
        assertThat(peak).isCloseTo(AudioPostProcessor.TARGET_PEAK, within(1e-4f));
        assertThat(avatar.calls()).containsExactly("talking:true", "talking:false");

        ItemProcessedEvent event = processed().get(0);
        assertThat(event.itemId()).isEqualTo("item-1");
        assertThat(event.outcome()).isEqualTo(ItemOutcome.COMPLETED);
        assertThat(event.failedStage()).isNull();
        assertThat(event.reason()).isNull();
    }

    @Test
    void shouldNotSignalAvatarWhenNotConnected() {
        ResponsePipeline pipeline = pipeline();

        pipeline.process(item(1, "hello"));

        assertThat(avatar.calls()).isEmpty();
        assertThat(sink.played()).hasSize(1);
    }

    @Test
    void shouldAbortFailedItemAndContinueWithNext() {
        // Arrange
        ResponsePipeline pipeline = pipeline();
        queue.enqueue(IncomingEvent.of("please fail now", Source.TEXT, "u1", "Alice"));
        queue.enqueue(IncomingEvent.of("how are you", Source.TEXT, "u2", "Bob"));
        queue.stop();

        // Act
        pipeline.run();

        // Assert
        assertThat(processed()).extracting(ItemProcessedEvent::outcome)
                .containsExactly(ItemOutcome.ABORTED, ItemOutcome.COMPLETED);
        ItemProcessedEvent failed = processed().get(0);
        assertThat(failed.failedStage()).isEqualTo(PipelineStage.GENERATING);
        assertThat(failed.reason()).contains("model timeout");
        assertThat(synthesizer.calls()).isEqualTo(1);
        assertThat(sink.played()).hasSize(1);
        assertThat(pipeline.stats().processed()).isEqualTo(2);
        assertThat(pipeline.stats().aborted()).isEqualTo(1);
        assertThat(pipeline.stats().completed()).isEqualTo(1);
    }

    @Test
    void shouldFinishSuppressedReplyWithoutSynthesis() {
        ResponsePipeline pipeline = pipeline();

        ItemOutcome outcome = pipeline.process(item(1, "please suppress this"));

        assertThat(outcome).isEqualTo(ItemOutcome.SUPPRESSED);
        assertThat(synthesizer.calls()).isZero();
        assertThat(sink.played()).isEmpty();
        assertThat(pipeline.stats().suppressed()).isEqualTo(1);
    }

    @Test
    void shouldAbortWhenSynthesizerUnavailable() {
        synthesizer.setAvailable(false);
        ResponsePipeline pipeline = pipeline();

        ItemOutcome outcome = pipeline.process(item(1, "hello"));

        assertThat(outcome).isEqualTo(ItemOutcome.ABORTED);
        assertThat(synthesizer.calls()).isZero();
        assertThat(processed().get(0).failedStage()).isEqualTo(PipelineStage.SYNTHESIZING);
        assertThat(processed().get(0).reason()).contains("unavailable");
    }

    @Test
    void shouldAbortWhenSynthesisThrows() {
        synthesizer.setFailing(true);
        ResponsePipeline pipeline = pipeline();

        assertThat(pipeline.process(item(1, "hello"))).isEqualTo(ItemOutcome.ABORTED);
        assertThat(processed().get(0).reason()).contains("synthesis failed");
    }

    @Test
    void shouldResetTalkingWhenPlaybackFails() {
        // Arrange
        sink.setFailing(true);
        ResponsePipeline pipeline = pipeline();
        pipeline.setAvatarConnected(true);

        // Act
        ItemOutcome outcome = pipeline.process(item(1, "hello"));

        // Assert
        assertThat(outcome).isEqualTo(ItemOutcome.ABORTED);
        assertThat(avatar.calls()).containsExactly("talking:true", "talking:false");
        assertThat(processed().get(0).failedStage()).isEqualTo(PipelineStage.PLAYING);
        assertThat(processed().get(0).reason()).contains("device unplugged");
    }

    @Test
    void shouldAbortWithoutTalkingWhenNoSinkConfigured() {
        ResponsePipeline pipeline = pipeline(generator, null);
        pipeline.setAvatarConnected(true);

        ItemOutcome outcome = pipeline.process(item(1, "hello"));

        assertThat(outcome).isEqualTo(ItemOutcome.ABORTED);
        assertThat(avatar.calls()).isEmpty();
        assertThat(processed().get(0).reason()).isEqualTo("no playback sink configured");
    }

    @Test
    void shouldAbortWhenNoGeneratorConfigured() {
        ResponsePipeline pipeline = pipeline(null, sink);

        assertThat(pipeline.process(item(1, "hello"))).isEqualTo(ItemOutcome.ABORTED);
        assertThat(processed().get(0).failedStage()).isEqualTo(PipelineStage.GENERATING);
    }

    @Test
    void shouldRejectConcurrentProcessing() throws Exception {
        // Arrange
        sink.holdPlayback();
        ResponsePipeline pipeline = pipeline();
        CompletableFuture<ItemOutcome> first = CompletableFuture.supplyAsync(() -> pipeline.process(item(1, "long one")));
        assertThat(sink.awaitPlaybackStarted(2000)).isTrue();

        // Act / Assert
        assertThat(pipeline.currentRun()).hasValueSatisfying(run -> {
            assertThat(run.item().itemId()).isEqualTo("item-1");
            assertThat(run.stage()).isEqualTo(PipelineStage.PLAYING);
        });
        assertThat(pipeline.stats().currentItem()).contains("item-1");
        assertThatThrownBy(() -> pipeline.process(item(2, "second")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("busy");

        sink.releasePlayback();
        assertThat(first.get(2, TimeUnit.SECONDS)).isEqualTo(ItemOutcome.COMPLETED);
        assertThat(pipeline.currentRun()).isEmpty();
        assertThat(generator.prompts()).containsExactly("long one");
    }

    @Test
    void shouldSkipStaleItemWithoutCallingCollaborators() {
        // Arrange
        long now = Duration.ofHours(1).toNanos();
        PipelineCollaborators collaborators = new PipelineCollaborators(
                generator, synthesizer, new AudioPostProcessor(), sink, avatar);
        ResponsePipeline pipeline = new ResponsePipeline(queue, collaborators,
                new PipelineProperties(Duration.ofSeconds(30)), stopSignal, new PipelineMetrics(registry, queue),
                publisher, () -> now, Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
        QueueItem old = new QueueItem(1, "hello?", Source.LIVE_CHAT, "u1", "Alice", Priority.NORMAL,
                now - Duration.ofSeconds(31).toNanos(), Instant.EPOCH, Map.of());

        // Act
        ItemOutcome outcome = pipeline.process(old);

        // Assert
        assertThat(outcome).isEqualTo(ItemOutcome.SKIPPED_STALE);
        assertThat(generator.prompts()).isEmpty();
        assertThat(processed().get(0).reason()).isEqualTo("stale");
        assertThat(processed().get(0).at()).isEqualTo(Instant.EPOCH);
    }

    @Test
    void shouldAbandonItemsAfterStopSignal() {
        ResponsePipeline pipeline = pipeline();
        stopSignal.trip();

        ItemOutcome outcome = pipeline.process(item(1, "hello"));

        assertThat(outcome).isEqualTo(ItemOutcome.ABANDONED);
        assertThat(generator.prompts()).isEmpty();
        assertThat(processed().get(0).reason()).isEqualTo("shutdown");
    }

    @Test
    void shouldCancelInFlightItemAtNextStage() {
        // Arrange
        AtomicReference<ResponsePipeline> self = new AtomicReference<>();
        AtomicReference<String> cancelled = new AtomicReference<>();
        ReplyGenerator cancelling = (text, user, source) -> {
            cancelled.set(self.get().cancelCurrent().orElse(null));
            return ReplyResult.reply("never spoken");
        };
        ResponsePipeline pipeline = pipeline(cancelling, sink);
        self.set(pipeline);

        // Act
        ItemOutcome outcome = pipeline.process(item(7, "hello"));

        // Assert
        assertThat(cancelled.get()).isEqualTo("item-7");
        assertThat(outcome).isEqualTo(ItemOutcome.ABORTED);
        assertThat(synthesizer.calls()).isZero();
        assertThat(processed().get(0).reason()).isEqualTo("cancelled before SYNTHESIZING");
    }

    @Test
    void shouldReportNothingToCancelWhenIdle() {
        assertThat(pipeline().cancelCurrent()).isEmpty();
    }

    @Test
    void shouldRecordOutcomeAndStageMetrics() {
        ResponsePipeline pipeline = pipeline();

        pipeline.process(item(1, "hello"));
        pipeline.process(item(2, "please fail"));

        assertThat(registry.get("talkbox.pipeline.items").tag("outcome", "completed").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("talkbox.pipeline.items").tag("outcome", "aborted").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("talkbox.pipeline.stage.latency").tag("stage", "generating").timer().count())
                .isEqualTo(2);
        assertThat(registry.get("talkbox.pipeline.stage.latency").tag("stage", "playing").timer().count())
                .isEqualTo(1);
    }

    @Test
    void shouldKeepRunningWhenEventListenerThrows() {
        PipelineCollaborators collaborators = new PipelineCollaborators(
                generator, synthesizer, new AudioPostProcessor(), sink, avatar);
        ResponsePipeline pipeline = new ResponsePipeline(queue, collaborators, new PipelineProperties(),
                stopSignal, new PipelineMetrics(registry, queue), event -> {
                    throw new IllegalStateException("listener broke");
                });

        assertThat(pipeline.process(item(1, "hello"))).isEqualTo(ItemOutcome.COMPLETED);
        assertThat(pipeline.stats().completed()).isEqualTo(1);
    }
}
