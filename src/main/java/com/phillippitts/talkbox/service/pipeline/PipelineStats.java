package com.phillippitts.talkbox.service.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Counters and last-run information for status output.
 *
 * @param processed items that left the pipeline with any outcome
 * @param completed items played back
 * @param suppressed items the generator declined
 * @param aborted items that failed or were cancelled
 * @param skippedStale items skipped for age
 * @param abandoned items dropped during shutdown
 * @param lastProcessingTime wall time of the most recent item, or null before the first
 * @param lastFinishedAt when the most recent item finished, or null before the first
 * @param currentItemId id of the item in flight, or null when idle
 */
public record PipelineStats(
        long processed,
        long completed,
        long suppressed,
        long aborted,
        long skippedStale,
        long abandoned,
        Duration lastProcessingTime,
        Instant lastFinishedAt,
        String currentItemId
) {
    public Optional<String> currentItem() {
        return Optional.ofNullable(currentItemId);
    }
}
