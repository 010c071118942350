package com.phillippitts.talkbox.exception;

/**
 * Thrown by a reply generator when the backing model call fails or times out.
 *
 * <p>A policy decision not to answer is not an error; generators return
 * {@link com.phillippitts.talkbox.domain.ReplyResult#suppressed(String)} instead.
 */
public class ReplyGenerationException extends TalkBoxException {

    public ReplyGenerationException(String message) {
        super(message);
    }

    public ReplyGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
