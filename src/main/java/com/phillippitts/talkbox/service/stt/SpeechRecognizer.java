package com.phillippitts.talkbox.service.stt;

/**
 * Contract for transcribing captured voice audio before it is queued.
 *
 * <p>Audio is raw PCM16LE mono as delivered by the voice adapter.
 */
public interface SpeechRecognizer {

    /**
     * @param audio PCM16LE mono audio
     * @param sampleRate sample rate in Hz
     * @return transcript; empty when nothing intelligible was said
     */
    String transcribe(byte[] audio, int sampleRate);
}
