package com.phillippitts.talkbox.exception;

/**
 * Base exception for all TalkBox application-specific errors.
 * Collaborator failures surface as subclasses so the pipeline can abort one item and move on.
 */
public class TalkBoxException extends RuntimeException {

    public TalkBoxException(String message) {
        super(message);
    }

    public TalkBoxException(String message, Throwable cause) {
        super(message, cause);
    }
}
