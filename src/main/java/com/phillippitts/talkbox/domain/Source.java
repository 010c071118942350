package com.phillippitts.talkbox.domain;

import java.util.Locale;

/**
 * Origin of an inbound event.
 *
 * <p>Wire names ({@code voice}, {@code text}, {@code live-chat}) are what adapters, REST clients and
 * admin commands use; {@link #fromWireName(String)} accepts them case-insensitively.
 */
public enum Source {
    VOICE("voice"),
    TEXT("text"),
    LIVE_CHAT("live-chat");

    private final String wireName;

    Source(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a source from its wire name or enum constant name.
     *
     * @param value wire name such as {@code live-chat}
     * @return matching source
     * @throws IllegalArgumentException if nothing matches
     */
    public static Source fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("source must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Source s : values()) {
            if (s.wireName.equals(normalized) || s.name().equalsIgnoreCase(normalized)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown source: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
