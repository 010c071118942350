package com.phillippitts.talkbox.service.events;

import com.phillippitts.talkbox.config.properties.FeedbackProperties;
import com.phillippitts.talkbox.domain.Source;
import com.phillippitts.talkbox.service.adapter.InteractiveAdapter;
import com.phillippitts.talkbox.service.ingest.event.EnqueueRejectedEvent;
import com.phillippitts.talkbox.service.pipeline.event.ItemProcessedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tells users when their request was turned away or could not be answered.
 *
 * <p>Messages go back through the adapter that produces the event's source. Throttled per user and
 * reason so a user spamming a full queue gets one notice, not one per message.
 */
@Component
class UserFeedbackListener {

    private static final Logger LOG = LogManager.getLogger(UserFeedbackListener.class);

    static final String MSG_QUEUE_FULL = "I'm a bit busy right now, please try again in a moment.";
    static final String MSG_PAUSED = "I'm taking a short break, please try again later.";
    static final String MSG_SOURCE_DISABLED = "I'm not listening on this channel right now.";
    static final String MSG_EVICTED = "Your message was dropped to make room for a priority request.";
    static final String MSG_FAILED = "Sorry, I couldn't answer that one.";
    static final String MSG_STALE = "Sorry, your message waited too long and was skipped.";

    private final ObjectProvider<InteractiveAdapter> adapters;
    private final Duration throttle;
    private final Clock clock;
    private final Map<String, Instant> lastSent = new ConcurrentHashMap<>();
    private volatile Instant lastPrune = Instant.EPOCH;

    @Autowired
    UserFeedbackListener(ObjectProvider<InteractiveAdapter> adapters, FeedbackProperties props) {
        this(adapters, props, Clock.systemUTC());
    }

    // Package-private for tests
    UserFeedbackListener(ObjectProvider<InteractiveAdapter> adapters, FeedbackProperties props, Clock clock) {
        this.adapters = adapters;
        this.throttle = props.getThrottle();
        this.clock = clock;
    }

    @EventListener
    void onEnqueueRejected(EnqueueRejectedEvent e) {
        String message = switch (e.status()) {
            case REJECTED_FULL -> MSG_QUEUE_FULL;
            case REJECTED_PAUSED -> MSG_PAUSED;
            case REJECTED_SOURCE_DISABLED -> MSG_SOURCE_DISABLED;
            case ACCEPTED_EVICTED_OLDEST -> MSG_EVICTED;
            // Shutting down; nobody is listening for the answer
            case REJECTED_CLOSED, ACCEPTED -> null;
        };
        if (message != null) {
            sendNotice(e.userId(), e.source(), e.status().name(), message);
        }
    }

    @EventListener
    void onItemProcessed(ItemProcessedEvent e) {
        switch (e.outcome()) {
            case ABORTED -> sendNotice(e.userId(), e.source(), "ABORTED", MSG_FAILED);
            case SKIPPED_STALE -> sendNotice(e.userId(), e.source(), "SKIPPED_STALE", MSG_STALE);
            default -> {
                // Completed, suppressed and abandoned items need no notice
            }
        }
    }

    // Package-private for tests
    boolean shouldNotify(String key) {
        Instant now = Instant.now(clock);
        pruneExpired(now);
        boolean[] allowed = new boolean[1];
        lastSent.compute(key, (k, prev) -> {
            if (prev == null || Duration.between(prev, now).compareTo(throttle) >= 0) {
                allowed[0] = true;
                return now;
            }
            return prev;
        });
        return allowed[0];
    }

    // Package-private for tests
    int trackedKeys() {
        return lastSent.size();
    }

    /** Drops entries whose throttle window has passed; runs at most once per window. */
    private void pruneExpired(Instant now) {
        if (Duration.between(lastPrune, now).compareTo(throttle) < 0) {
            return;
        }
        lastPrune = now;
        lastSent.values().removeIf(sent -> Duration.between(sent, now).compareTo(throttle) >= 0);
    }

    private void sendNotice(String userId, Source source, String reason, String message) {
        if (!shouldNotify(userId + '-' + reason)) {
            LOG.debug("Feedback to {} for {} throttled", userId, reason);
            return;
        }
        Optional<InteractiveAdapter> adapter = adapterFor(source);
        if (adapter.isEmpty()) {
            LOG.debug("No adapter for source {}; feedback to {} dropped", source, userId);
            return;
        }
        try {
            adapter.get().sendFeedback(userId, message);
        } catch (Exception ex) {
            LOG.debug("Feedback to {} via {} failed: {}", userId, adapter.get().name(), ex.toString());
        }
    }

    private Optional<InteractiveAdapter> adapterFor(Source source) {
        List<InteractiveAdapter> all = adapters.orderedStream().toList();
        return all.stream().filter(a -> a.sources().contains(source)).findFirst();
    }
}
