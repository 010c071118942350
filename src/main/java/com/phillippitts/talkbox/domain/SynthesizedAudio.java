package com.phillippitts.talkbox.domain;

import java.util.Objects;

/**
 * Mono audio produced by speech synthesis, as normalized floating-point samples in [-1, 1].
 */
public record SynthesizedAudio(float[] samples, int sampleRate) {

    public SynthesizedAudio {
        Objects.requireNonNull(samples, "samples");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
    }

    public double durationSeconds() {
        return (double) samples.length / sampleRate;
    }

    @Override
    public String toString() {
        return "SynthesizedAudio[samples=" + samples.length + ", sampleRate=" + sampleRate + "]";
    }
}
