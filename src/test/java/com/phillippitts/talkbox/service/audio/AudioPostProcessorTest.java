package com.phillippitts.talkbox.service.audio;

import com.phillippitts.talkbox.exception.InvalidAudioException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AudioPostProcessorTest {

    private static final float EPS = 1e-5f;

    private final AudioPostProcessor processor = new AudioPostProcessor();

    private static float peak(float[] samples) {
        float p = 0;
        for (float s : samples) {
            p = Math.max(p, Math.abs(s));
        }
        return p;
    }

    private static double mean(float[] samples) {
        double sum = 0;
        for (float s : samples) {
            sum += s;
        }
        return sum / samples.length;
    }

    @Test
    void shouldNormalizeAlternatingHalfScaleToTargetPeak() {
        float[] out = processor.process(new float[]{0.5f, -0.5f, 0.5f, -0.5f}, 16_000);

        assertThat(out).containsExactly(new float[]{0.95f, -0.95f, 0.95f, -0.95f}, within(EPS));
    }

    @Test
    void shouldRemoveDcOffsetAndKeepTargetPeak() {
        float[] in = new float[100];
        for (int i = 0; i < in.length; i++) {
            in[i] = 0.3f + 0.2f * (float) Math.sin(i / 5.0);
        }

        float[] out = processor.process(in, 22_050);

        assertThat(peak(out)).isCloseTo(AudioPostProcessor.TARGET_PEAK, within(EPS));
        assertThat(mean(out)).isCloseTo(0.0, within(1e-5));
    }

    @Test
    void shouldCenterShortAsymmetricBufferAtTargetPeak() {
        float[] out = processor.process(new float[]{0.1f, -0.4f, 0.2f}, 16_000);

        assertThat(peak(out)).isCloseTo(AudioPostProcessor.TARGET_PEAK, within(EPS));
        assertThat(mean(out)).isCloseTo(0.0, within(1e-6));
        assertThat(out).containsExactly(new float[]{0.345454f, -0.95f, 0.604545f}, within(EPS));
    }

    @Test
    void shouldReturnSilenceUnchanged() {
        float[] out = processor.process(new float[]{0f, 0f, 0f}, 16_000);

        assertThat(out).containsExactly(0f, 0f, 0f);
    }

    @Test
    void shouldTurnConstantSignalIntoSilence() {
        float[] out = processor.process(new float[]{0.4f, 0.4f, 0.4f}, 16_000);

        assertThat(out).containsExactly(new float[]{0f, 0f, 0f}, within(EPS));
    }

    @Test
    void shouldReturnEmptyBufferForEmptyInput() {
        assertThat(processor.process(new float[0], 16_000)).isEmpty();
    }

    @Test
    void shouldNotModifyInputBuffer() {
        float[] in = {0.1f, -0.2f, 0.3f};

        processor.process(in, 16_000);

        assertThat(in).containsExactly(0.1f, -0.2f, 0.3f);
    }

    @Test
    void shouldConvertPcm16BeforeNormalizing() {
        short[] pcm = {16384, -16384, 16384, -16384};

        float[] out = processor.process(pcm, 16_000);

        assertThat(out).containsExactly(new float[]{0.95f, -0.95f, 0.95f, -0.95f}, within(EPS));
    }

    @Test
    void shouldRejectNonFiniteSamples() {
        assertThatThrownBy(() -> processor.process(new float[]{0.1f, Float.NaN}, 16_000))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("sample 1");
        assertThatThrownBy(() -> processor.process(new float[]{Float.POSITIVE_INFINITY}, 16_000))
                .isInstanceOf(InvalidAudioException.class);
    }

    @Test
    void shouldRejectNonPositiveSampleRate() {
        assertThatThrownBy(() -> processor.process(new float[]{0.1f}, 0))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("sample rate");
        assertThatThrownBy(() -> processor.process(new short[]{1}, -8_000))
                .isInstanceOf(InvalidAudioException.class);
    }
}
