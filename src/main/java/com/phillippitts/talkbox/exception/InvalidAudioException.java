package com.phillippitts.talkbox.exception;

/**
 * Thrown when an audio buffer cannot be post-processed: non-finite samples or an invalid sample rate.
 */
public class InvalidAudioException extends TalkBoxException {

    private final int sampleIndex;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio buffer: " + reason);
        this.sampleIndex = -1;
        this.reason = reason;
    }

    public InvalidAudioException(int sampleIndex, String reason) {
        super("Invalid audio buffer at sample " + sampleIndex + ": " + reason);
        this.sampleIndex = sampleIndex;
        this.reason = reason;
    }

    /** Index of the offending sample, or -1 when the problem is not a single sample. */
    public int getSampleIndex() {
        return sampleIndex;
    }

    public String getReason() {
        return reason;
    }
}
