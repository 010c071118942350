package com.phillippitts.talkbox.service.adapter;

import com.phillippitts.talkbox.domain.Source;

import java.util.Set;

/**
 * A long-lived connection to an interactive host (chat server, voice channel, live-stream chat).
 *
 * <p>Each adapter runs under its own connection supervisor. {@link #start(Runnable)} blocks for the
 * lifetime of one session: it returns normally when the adapter was stopped or the host closed the
 * session cleanly, and throws when the connection failed and should be retried.
 */
public interface InteractiveAdapter {

    /** Name for logs, thread names and status output. */
    String name();

    /** Sources this adapter produces, used to route user feedback. */
    Set<Source> sources();

    /**
     * Connects and runs one session.
     *
     * @param onConnected to be called once the session is live
     * @throws Exception when the session failed
     */
    void start(Runnable onConnected) throws Exception;

    /** Ends the current session, causing {@link #start(Runnable)} to return. Must be idempotent. */
    void stop() throws Exception;

    /**
     * Sends a short message back to a user (e.g. "queue is full").
     *
     * @throws Exception if the message could not be delivered
     */
    void sendFeedback(String userId, String message) throws Exception;
}
