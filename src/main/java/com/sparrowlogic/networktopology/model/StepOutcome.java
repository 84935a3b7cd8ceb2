package com.sparrowlogic.networktopology.model;

public record StepOutcome(String step, String action, String resourceId, Status status, String reason) {

    public enum Status { SUCCEEDED, SKIPPED_NOT_FOUND, FAILED }

    public static StepOutcome succeeded(String step, String action, String resourceId) {
        return new StepOutcome(step, action, resourceId, Status.SUCCEEDED, null);
    }

    public static StepOutcome notFound(String step, String action, String resourceId, String reason) {
        return new StepOutcome(step, action, resourceId, Status.SKIPPED_NOT_FOUND, reason);
    }

    public static StepOutcome failed(String step, String action, String resourceId, String reason) {
        return new StepOutcome(step, action, resourceId, Status.FAILED, reason);
    }
}
