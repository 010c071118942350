package com.phillippitts.talkbox.service.pipeline;

/** How an item left the pipeline. */
public enum ItemOutcome {
    /** Reply was generated, synthesized and played. */
    COMPLETED,
    /** The reply generator declined to answer. */
    SUPPRESSED,
    /** A stage failed or the item was cancelled. */
    ABORTED,
    /** The item waited longer than the configured maximum age. */
    SKIPPED_STALE,
    /** Dequeued after shutdown started; not processed. */
    ABANDONED
}
