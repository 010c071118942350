package com.phillippitts.talkbox.exception;

/**
 * Thrown when the playback sink cannot play a buffer (device unavailable, line closed, etc.).
 */
public class PlaybackException extends TalkBoxException {

    public PlaybackException(String message) {
        super(message);
    }

    public PlaybackException(String message, Throwable cause) {
        super(message, cause);
    }
}
