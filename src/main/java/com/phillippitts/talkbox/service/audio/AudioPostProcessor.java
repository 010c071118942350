package com.phillippitts.talkbox.service.audio;

import com.phillippitts.talkbox.exception.InvalidAudioException;

/**
 * Normalizes synthesized speech before playback.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Scale so the largest absolute sample is {@value #TARGET_PEAK} (skipped for pure silence)</li>
 *   <li>Subtract the mean to remove DC offset</li>
 *   <li>If removing the offset moved the peak, scale once more to {@value #TARGET_PEAK}</li>
 * </ol>
 *
 * <p>Scaling does not change a zero mean, so the output has peak {@value #TARGET_PEAK} and mean 0
 * (within float rounding) for any non-constant input. A constant input becomes all zeros.
 *
 * <p>Pure and stateless; safe to share across threads.
 */
public class AudioPostProcessor {

    /** Peak amplitude after normalization. Leaves a little headroom below full scale. */
    public static final float TARGET_PEAK = 0.95f;

    private static final float PCM16_SCALE = 32768f;

    /**
     * Normalizes a float buffer in [-1, 1] (values outside are accepted and scaled down).
     *
     * @param samples mono samples, not modified
     * @param sampleRate sample rate in Hz; carried for validation only
     * @return a new normalized buffer of the same length
     * @throws InvalidAudioException if any sample is NaN or infinite, or sampleRate is not positive
     */
    public float[] process(float[] samples, int sampleRate) {
        if (samples == null) {
            throw new InvalidAudioException("samples must not be null");
        }
        validateSampleRate(sampleRate);
        if (samples.length == 0) {
            return new float[0];
        }

        double[] work = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            float s = samples[i];
            if (!Float.isFinite(s)) {
                throw new InvalidAudioException(i, "non-finite sample " + s);
            }
            work[i] = s;
        }

        scaleToTargetPeak(work);
        removeDcOffset(work);
        scaleToTargetPeak(work);

        float[] out = new float[work.length];
        for (int i = 0; i < work.length; i++) {
            out[i] = (float) work[i];
        }
        return out;
    }

    /**
     * Converts signed 16-bit PCM to floats in [-1, 1] and normalizes them.
     *
     * @see #process(float[], int)
     */
    public float[] process(short[] pcm16, int sampleRate) {
        if (pcm16 == null) {
            throw new InvalidAudioException("samples must not be null");
        }
        validateSampleRate(sampleRate);
        float[] samples = new float[pcm16.length];
        for (int i = 0; i < pcm16.length; i++) {
            samples[i] = pcm16[i] / PCM16_SCALE;
        }
        return process(samples, sampleRate);
    }

    private static void validateSampleRate(int sampleRate) {
        if (sampleRate <= 0) {
            throw new InvalidAudioException("sample rate must be positive: " + sampleRate);
        }
    }

    private static void scaleToTargetPeak(double[] work) {
        double peak = 0;
        for (double v : work) {
            peak = Math.max(peak, Math.abs(v));
        }
        if (peak == 0 || peak == TARGET_PEAK) {
            return;
        }
        double gain = TARGET_PEAK / peak;
        for (int i = 0; i < work.length; i++) {
            work[i] *= gain;
        }
    }

    private static void removeDcOffset(double[] work) {
        double sum = 0;
        for (double v : work) {
            sum += v;
        }
        double mean = sum / work.length;
        for (int i = 0; i < work.length; i++) {
            work[i] -= mean;
        }
    }
}
