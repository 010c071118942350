package com.phillippitts.talkbox.service.supervisor;

/**
 * A long-lived connection a {@link ConnectionSupervisor} keeps alive.
 */
@FunctionalInterface
public interface SupervisedConnection {

    /**
     * Connects and runs one session until it ends.
     *
     * @param onConnected to be called once the session is live
     * @throws Exception if the session failed and should be retried
     */
    void connectAndRun(Runnable onConnected) throws Exception;
}
