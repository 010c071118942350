package com.phillippitts.talkbox.service.tts;

import com.phillippitts.talkbox.domain.SynthesizedAudio;
import com.phillippitts.talkbox.exception.SpeechSynthesisException;

/**
 * Contract for text-to-speech engines.
 *
 * <p>Output is mono float audio; the pipeline normalizes it before playback, so engines need not
 * worry about levels.
 */
public interface SpeechSynthesizer {

    /**
     * Synthesizes speech for a reply.
     *
     * @param text reply text, never blank
     * @return synthesized audio
     * @throws SpeechSynthesisException if the engine fails
     */
    SynthesizedAudio synthesize(String text);

    /**
     * Checks if the engine can currently synthesize. The pipeline aborts an item without calling
     * {@link #synthesize(String)} when this returns false.
     */
    boolean isAvailable();

    /** Name for logs/metrics. */
    default String name() {
        return getClass().getSimpleName();
    }
}
