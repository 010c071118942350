package com.phillippitts.talkbox.domain;

import java.util.Optional;

/**
 * Result of reply generation: either reply text, or a suppression with the policy reason.
 *
 * <p>Suppression is a normal outcome (the generator decided not to answer), not a failure.
 */
public record ReplyResult(String replyText, String reason) {

    public static ReplyResult reply(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("reply text must not be blank");
        }
        return new ReplyResult(text, null);
    }

    public static ReplyResult suppressed(String reason) {
        return new ReplyResult(null, reason == null ? "suppressed" : reason);
    }

    public boolean isSuppressed() {
        return replyText == null;
    }

    public Optional<String> text() {
        return Optional.ofNullable(replyText);
    }
}
