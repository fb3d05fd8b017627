package dev.devanks.mediagen.orchestrator.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.devanks.mediagen.orchestrator.TestFixtures;
import dev.devanks.mediagen.orchestrator.backend.BackendSession;
import dev.devanks.mediagen.orchestrator.backend.GenerationBackend;
import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import dev.devanks.mediagen.orchestrator.model.SubmissionOutcome;
import dev.devanks.mediagen.orchestrator.model.SubmissionVariant;
import dev.devanks.mediagen.orchestrator.model.Task;
import dev.devanks.mediagen.orchestrator.model.TaskStatus;
import dev.devanks.mediagen.orchestrator.model.VendorSubmission;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskSubmitter Unit Tests")
class TaskSubmitterTest {

    private static final VendorSubmission SUBMISSION = VendorSubmission.builder()
            .route("TEXT_TO_VIDEO")
            .payload(JsonNodeFactory.instance.objectNode())
            .routingKey("52")
            .variant(SubmissionVariant.TEXT_ONLY)
            .build();

    @Mock
    private GenerationBackend mockBackend;

    private final TaskSubmitter taskSubmitter = new TaskSubmitter();
    private final OrchestratorSettings settings = TestFixtures.settings();
    private final Task task = new Task(Instant.now());

    private BackendSession session() {
        return new BackendSession(mockBackend, settings);
    }

    @Test
    @DisplayName("submit: accepted task gets id and routing key and stays SUBMITTED")
    void submit_accepted() {
        when(mockBackend.submit(SUBMISSION, settings)).thenReturn(SubmissionOutcome.accepted("t-1"));

        SubmissionOutcome outcome = taskSubmitter.submit(session(), task, SUBMISSION);

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(task.getId()).isEqualTo("t-1");
        assertThat(task.getRoutingKey()).isEqualTo("52");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.SUBMITTED);
    }

    @Test
    @DisplayName("submit: content-policy rejection fails the task immediately")
    void submit_contentPolicy() {
        when(mockBackend.submit(SUBMISSION, settings))
                .thenReturn(SubmissionOutcome.rejected(FailureCategory.CONTENT_POLICY_REJECTION, "code=70026"));

        SubmissionOutcome outcome = taskSubmitter.submit(session(), task, SUBMISSION);

        assertThat(outcome.isAccepted()).isFalse();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getErrorInfo().getCategory()).isEqualTo(FailureCategory.CONTENT_POLICY_REJECTION);
        assertThat(task.getId()).isNull();
    }

    @Test
    @DisplayName("submit: unexpected exception is a submission error")
    void submit_unexpectedException() {
        when(mockBackend.submit(SUBMISSION, settings)).thenThrow(new IllegalStateException("boom"));

        SubmissionOutcome outcome = taskSubmitter.submit(session(), task, SUBMISSION);

        assertThat(outcome.getError().getCategory()).isEqualTo(FailureCategory.SUBMISSION_ERROR);
        assertThat(task.getErrorInfo().getDetail()).isEqualTo("boom");
    }
}
