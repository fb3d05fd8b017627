package dev.devanks.mediagen.orchestrator.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either an accepted task id or the classified reason the service refused the submission.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubmissionOutcome {

    String taskId;
    ErrorInfo error;

    public static SubmissionOutcome accepted(String taskId) {
        return new SubmissionOutcome(taskId, null);
    }

    public static SubmissionOutcome rejected(FailureCategory category, String detail) {
        return new SubmissionOutcome(null, ErrorInfo.of(category, detail));
    }

    public boolean isAccepted() {
        return taskId != null;
    }
}
