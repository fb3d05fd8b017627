package dev.devanks.mediagen.orchestrator.service;

import dev.devanks.mediagen.orchestrator.backend.BackendSession;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import dev.devanks.mediagen.orchestrator.model.SubmissionOutcome;
import dev.devanks.mediagen.orchestrator.model.Task;
import dev.devanks.mediagen.orchestrator.model.TaskStatus;
import dev.devanks.mediagen.orchestrator.model.VendorSubmission;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TaskSubmitter {

    /**
     * Sends the request. On acceptance the task gets its id and stays SUBMITTED; on refusal it is failed
     * right away with the classified error.
     */
    public SubmissionOutcome submit(BackendSession session, Task task, VendorSubmission submission) {
        SubmissionOutcome outcome;
        try {
            outcome = session.submit(submission);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Submission failed unexpectedly: {}", e.getMessage(), e);
            outcome = SubmissionOutcome.rejected(FailureCategory.SUBMISSION_ERROR, e.getMessage());
        }

        if (outcome.isAccepted()) {
            task.assignId(outcome.getTaskId(), submission.getRoutingKey());
            log.info("Task {} submitted.", task.getId());
        } else {
            log.warn("Submission rejected ({}): {}", outcome.getError().getCategory(), outcome.getError().getDetail());
            task.fail(TaskStatus.FAILED, outcome.getError());
        }
        return outcome;
    }
}
