package com.phillippitts.talkbox.domain;

/**
 * Queue priority class, derived at enqueue time from the configured admin set.
 */
public enum Priority {
    ADMIN,
    NORMAL
}
