package com.phillippitts.talkbox.testutil;

import com.phillippitts.talkbox.domain.SynthesizedAudio;
import com.phillippitts.talkbox.exception.SpeechSynthesisException;
import com.phillippitts.talkbox.service.tts.SpeechSynthesizer;

import java.util.concurrent.atomic.AtomicInteger;

/** Synthesizer producing a short ramp with a DC offset, so normalization has work to do. */
public class FakeSpeechSynthesizer implements SpeechSynthesizer {

    public static final int SAMPLE_RATE = 16_000;

    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean available = true;
    private volatile boolean failing;

    @Override
    public SynthesizedAudio synthesize(String text) {
        calls.incrementAndGet();
        if (failing) {
            throw new SpeechSynthesisException("synthesis failed", "fake");
        }
        float[] samples = new float[160];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = 0.1f + (i % 20) / 40f;
        }
        return new SynthesizedAudio(samples, SAMPLE_RATE);
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int calls() {
        return calls.get();
    }
}
