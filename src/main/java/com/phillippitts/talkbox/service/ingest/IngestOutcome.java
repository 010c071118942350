package com.phillippitts.talkbox.service.ingest;

import com.phillippitts.talkbox.service.queue.EnqueueResult;

import java.util.Optional;

/**
 * What the core did with one inbound event, returned to the adapter that delivered it.
 *
 * @param type broad outcome
 * @param enqueueResult queue result when the event reached the queue, otherwise null
 * @param message reply for admin commands, or the reason an event was ignored
 */
public record IngestOutcome(Type type, EnqueueResult enqueueResult, String message) {

    public enum Type {
        /** Accepted into the queue. */
        QUEUED,
        /** The queue rejected it; see {@link EnqueueResult#status()}. */
        REJECTED,
        /** Dropped before the queue (blank text, silence, transcription failure). */
        IGNORED,
        /** Handled immediately as an admin command. */
        COMMAND
    }

    static IngestOutcome fromEnqueue(EnqueueResult result) {
        return new IngestOutcome(result.isAccepted() ? Type.QUEUED : Type.REJECTED, result, null);
    }

    static IngestOutcome ignored(String reason) {
        return new IngestOutcome(Type.IGNORED, null, reason);
    }

    static IngestOutcome command(String reply) {
        return new IngestOutcome(Type.COMMAND, null, reply);
    }

    public Optional<String> reply() {
        return Optional.ofNullable(message);
    }
}
