package com.phillippitts.talkbox.service.ingest.event;

import com.phillippitts.talkbox.domain.Source;
import com.phillippitts.talkbox.service.queue.EnqueueResult;

import java.time.Instant;

/**
 * Published when the queue turns an event away, or evicts a queued item to make room for an admin.
 *
 * @param userId originator of the rejected or evicted event
 * @param source where the event came from
 * @param status why; {@code ACCEPTED_EVICTED_OLDEST} marks the evicted originator
 * @param at when it happened
 */
public record EnqueueRejectedEvent(String userId, Source source, EnqueueResult.Status status, Instant at) {}
