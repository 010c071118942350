package com.phillippitts.talkbox.service.supervisor;

/**
 * Lifecycle of one supervised connection.
 *
 * <pre>
 * DISCONNECTED → CONNECTING → CONNECTED
 *                    ↑            │ failure
 *                    └─ RETRYING ←┘
 * </pre>
 * A supervisor that stops for good ends in DISCONNECTED.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RETRYING
}
