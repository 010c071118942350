package com.phillippitts.talkbox.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An event as submitted by a producer, before the queue stamps priority and timestamps.
 *
 * @param content text payload (already transcribed for voice input)
 * @param source where the event came from
 * @param userId opaque originator id
 * @param userName display name of the originator
 * @param metadata source-specific extras, passed through untouched
 */
public record IncomingEvent(
        String content,
        Source source,
        String userId,
        String userName,
        Map<String, Object> metadata
) {
    public IncomingEvent {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(userId, "userId");
        if (userName == null || userName.isBlank()) {
            userName = "Unknown";
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static IncomingEvent of(String content, Source source, String userId, String userName) {
        return new IncomingEvent(content, source, userId, userName, Map.of());
    }
}
