package com.phillippitts.talkbox.service.adapter;

import com.phillippitts.talkbox.service.ingest.IngestOutcome;

/**
 * Callbacks an {@link InteractiveAdapter} uses to hand inbound events to the core.
 *
 * <p>Passed to adapters at construction. Implementations are thread-safe; adapters may call from
 * any thread.
 */
public interface InboundEventHandler {

    /**
     * Captured speech from a voice channel. Transcribed before queuing; silence is dropped.
     *
     * @param audio PCM16LE mono audio
     * @param sampleRate sample rate in Hz
     */
    IngestOutcome onVoiceInput(String userId, String userName, byte[] audio, int sampleRate);

    /** A text command, e.g. a chat-bot command. Admin "!" commands are handled immediately. */
    IngestOutcome onTextCommand(String userId, String userName, String text);

    /** A message from a live-stream chat. */
    IngestOutcome onLiveChatMessage(String userId, String userName, String message);
}
