package com.phillippitts.talkbox.service.lifecycle;

import java.time.Duration;
import java.util.List;

/**
 * What happened during {@link LifecycleCoordinator#shutdown()}.
 *
 * @param alreadyStopping true when shutdown had already been requested; no steps ran
 * @param steps step results in execution order
 * @param elapsed time the shutdown took
 */
public record ShutdownReport(boolean alreadyStopping, List<StepResult> steps, Duration elapsed) {

    public ShutdownReport {
        steps = List.copyOf(steps);
    }

    static ShutdownReport alreadyStoppingReport() {
        return new ShutdownReport(true, List.of(), Duration.ZERO);
    }

    public boolean allSucceeded() {
        return steps.stream().allMatch(StepResult::success);
    }

    public List<StepResult> failures() {
        return steps.stream().filter(s -> !s.success()).toList();
    }
}
