package com.phillippitts.talkbox.service.lifecycle;

/**
 * Result of one shutdown step.
 *
 * @param name step name, e.g. {@code stop-queue}
 * @param status whether the step ran cleanly, failed, or was not needed
 * @param error failure message when {@code status} is FAILED, otherwise null
 */
public record StepResult(String name, Status status, String error) {

    public enum Status { OK, FAILED, SKIPPED }

    public static StepResult ok(String name) {
        return new StepResult(name, Status.OK, null);
    }

    public static StepResult failed(String name, String error) {
        return new StepResult(name, Status.FAILED, error);
    }

    public static StepResult skipped(String name) {
        return new StepResult(name, Status.SKIPPED, null);
    }

    /** True unless the step failed. */
    public boolean success() {
        return status != Status.FAILED;
    }
}
