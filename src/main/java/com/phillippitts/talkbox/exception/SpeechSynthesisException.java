package com.phillippitts.talkbox.exception;

/**
 * Thrown by a speech synthesizer when it cannot produce audio for a reply.
 */
public class SpeechSynthesisException extends TalkBoxException {

    private final String engineName;

    public SpeechSynthesisException(String message) {
        this(message, "unknown");
    }

    public SpeechSynthesisException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public SpeechSynthesisException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
