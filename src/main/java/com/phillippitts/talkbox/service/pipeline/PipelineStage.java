package com.phillippitts.talkbox.service.pipeline;

/**
 * Stages an item moves through in the response pipeline.
 *
 * <pre>
 * QUEUED → GENERATING → SYNTHESIZING → POST_PROCESSING → PLAYING → DONE
 *    └──────────┴────────────┴───────────────┴─────────────┴──→ ABORTED
 * </pre>
 */
public enum PipelineStage {
    QUEUED,
    GENERATING,
    SYNTHESIZING,
    POST_PROCESSING,
    PLAYING,
    DONE,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }
}
