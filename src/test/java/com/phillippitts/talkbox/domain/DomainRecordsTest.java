package com.phillippitts.talkbox.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainRecordsTest {

    @Test
    void incomingEventShouldDefaultNameAndCopyMetadata() {
        Map<String, Object> meta = new HashMap<>();
        meta.put("k", "v");

        IncomingEvent event = new IncomingEvent("hi", Source.TEXT, "u1", " ", meta);
        meta.put("k2", "v2");

        assertThat(event.userName()).isEqualTo("Unknown");
        assertThat(event.metadata()).containsOnlyKeys("k");
    }

    @Test
    void shouldPassThroughMetadataWithNullValues() {
        Map<String, Object> meta = new HashMap<>();
        meta.put("guild", null);
        meta.put("channel", "general");

        IncomingEvent event = new IncomingEvent("hi", Source.TEXT, "u1", "A", meta);
        QueueItem item = QueueItem.from(event, 1, Priority.NORMAL, 0L, Instant.EPOCH);

        assertThat(event.metadata()).containsEntry("guild", null).containsEntry("channel", "general");
        assertThat(item.metadata()).containsEntry("guild", null).hasSize(2);
        assertThatThrownBy(() -> item.metadata().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void queueItemShouldDeriveIdAndPriorityFlag() {
        QueueItem item = QueueItem.from(IncomingEvent.of("hi", Source.TEXT, "admin", "Mod"),
                42, Priority.ADMIN, 0L, Instant.EPOCH);

        assertThat(item.itemId()).isEqualTo("item-42");
        assertThat(item.isAdmin()).isTrue();
    }

    @Test
    void replyResultShouldDistinguishSuppression() {
        assertThat(ReplyResult.reply("hello").isSuppressed()).isFalse();
        assertThat(ReplyResult.reply("hello").text()).contains("hello");
        assertThat(ReplyResult.suppressed("policy").isSuppressed()).isTrue();
        assertThat(ReplyResult.suppressed(null).reason()).isEqualTo("suppressed");
        assertThatThrownBy(() -> ReplyResult.reply(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
