package com.phillippitts.talkbox.service.pipeline.event;

import com.phillippitts.talkbox.domain.Source;
import com.phillippitts.talkbox.service.pipeline.ItemOutcome;
import com.phillippitts.talkbox.service.pipeline.PipelineStage;

import java.time.Duration;
import java.time.Instant;

/**
 * Published when an item leaves the response pipeline, whatever the outcome.
 *
 * @param itemId queue item id
 * @param source where the item came from
 * @param userId originator, used to route feedback
 * @param outcome how the item finished
 * @param failedStage stage that failed when aborted, otherwise null
 * @param reason abort or suppression reason, otherwise null
 * @param elapsed time spent in the pipeline
 * @param at when the item finished
 */
public record ItemProcessedEvent(
        String itemId,
        Source source,
        String userId,
        ItemOutcome outcome,
        PipelineStage failedStage,
        String reason,
        Duration elapsed,
        Instant at
) {}
