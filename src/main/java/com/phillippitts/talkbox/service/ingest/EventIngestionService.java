package com.phillippitts.talkbox.service.ingest;

import com.phillippitts.talkbox.domain.IncomingEvent;
import com.phillippitts.talkbox.domain.Source;
import com.phillippitts.talkbox.service.adapter.InboundEventHandler;
import com.phillippitts.talkbox.service.admin.AdminCommandHandler;
import com.phillippitts.talkbox.service.ingest.event.EnqueueRejectedEvent;
import com.phillippitts.talkbox.service.metrics.PipelineMetrics;
import com.phillippitts.talkbox.service.queue.EnqueueResult;
import com.phillippitts.talkbox.service.queue.QueueManager;
import com.phillippitts.talkbox.service.stt.SpeechRecognizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Producer-side entry point handed to every adapter.
 *
 * <p>Voice input is transcribed first and dropped when nothing was said. Admin commands in text
 * input are executed immediately. Everything else goes to the queue, and rejections or evictions
 * are published as {@link EnqueueRejectedEvent} so the originator can be told.
 *
 * <p>Thread-safe; adapters call it from their own threads.
 */
public class EventIngestionService implements InboundEventHandler {

    private static final Logger LOG = LogManager.getLogger(EventIngestionService.class);

    static final String META_SAMPLE_RATE = "sample_rate";
    static final String META_AUDIO_BYTES = "audio_bytes";

    private final QueueManager queue;
    private final SpeechRecognizer recognizer;
    private final AdminCommandHandler adminCommands;
    private final PipelineMetrics metrics;
    private final ApplicationEventPublisher publisher;

    /**
     * @param recognizer speech recognizer, or null when voice input is not supported
     */
    public EventIngestionService(QueueManager queue,
                                 SpeechRecognizer recognizer,
                                 AdminCommandHandler adminCommands,
                                 PipelineMetrics metrics,
                                 ApplicationEventPublisher publisher) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.recognizer = recognizer;
        this.adminCommands = Objects.requireNonNull(adminCommands, "adminCommands");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public IngestOutcome onVoiceInput(String userId, String userName, byte[] audio, int sampleRate) {
        if (recognizer == null) {
            LOG.warn("Voice input from {} dropped: no speech recognizer configured", userName);
            return IngestOutcome.ignored("no speech recognizer configured");
        }
        if (audio == null || audio.length == 0) {
            return IngestOutcome.ignored("empty audio");
        }
        String transcript;
        try {
            transcript = recognizer.transcribe(audio, sampleRate);
        } catch (RuntimeException e) {
            LOG.warn("Transcription failed for {}: {}", userName, e.getMessage());
            return IngestOutcome.ignored("transcription failed");
        }
        if (transcript == null || transcript.isBlank()) {
            LOG.debug("No speech detected in {} bytes from {}", audio.length, userName);
            return IngestOutcome.ignored("no speech detected");
        }
        Map<String, Object> metadata = Map.of(META_SAMPLE_RATE, sampleRate, META_AUDIO_BYTES, audio.length);
        return submit(new IncomingEvent(transcript.strip(), Source.VOICE, userId, userName, metadata));
    }

    @Override
    public IngestOutcome onTextCommand(String userId, String userName, String text) {
        if (text == null || text.isBlank()) {
            return IngestOutcome.ignored("empty message");
        }
        Optional<String> reply = adminCommands.handle(userId, text);
        if (reply.isPresent()) {
            return IngestOutcome.command(reply.get());
        }
        return submit(IncomingEvent.of(text.strip(), Source.TEXT, userId, userName));
    }

    @Override
    public IngestOutcome onLiveChatMessage(String userId, String userName, String message) {
        if (message == null || message.isBlank()) {
            return IngestOutcome.ignored("empty message");
        }
        return submit(IncomingEvent.of(message.strip(), Source.LIVE_CHAT, userId, userName));
    }

    /** Queues a prepared event; used by the REST layer as well as the callbacks above. */
    public IngestOutcome submit(IncomingEvent event) {
        EnqueueResult result = queue.enqueue(event);
        metrics.recordEnqueue(result.status());
        Instant now = Instant.now();
        if (!result.isAccepted()) {
            publisher.publishEvent(new EnqueueRejectedEvent(event.userId(), event.source(), result.status(), now));
        }
        result.evictedItem().ifPresent(evicted -> publisher.publishEvent(new EnqueueRejectedEvent(
                evicted.userId(), evicted.source(), EnqueueResult.Status.ACCEPTED_EVICTED_OLDEST, now)));
        return IngestOutcome.fromEnqueue(result);
    }
}
