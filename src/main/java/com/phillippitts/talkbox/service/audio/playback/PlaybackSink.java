package com.phillippitts.talkbox.service.audio.playback;

import com.phillippitts.talkbox.exception.PlaybackException;

/**
 * Plays a normalized mono buffer to an output device.
 *
 * <p>{@link #play(float[], int)} blocks until the buffer has been played, so the pipeline's PLAYING
 * stage lasts as long as the audio.
 */
public interface PlaybackSink {

    /**
     * @param samples mono samples in [-1, 1]
     * @param sampleRate sample rate in Hz
     * @throws PlaybackException if the device is unavailable or playback fails
     */
    void play(float[] samples, int sampleRate);
}
