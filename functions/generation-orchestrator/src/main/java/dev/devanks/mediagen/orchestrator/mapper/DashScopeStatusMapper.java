package dev.devanks.mediagen.orchestrator.mapper;

import com.google.common.collect.ImmutableMap;
import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import dev.devanks.mediagen.orchestrator.model.PollObservation;
import dev.devanks.mediagen.orchestrator.model.SubmissionOutcome;
import dev.devanks.mediagen.orchestrator.model.UpstreamStatus;
import dev.devanks.mediagen.orchestrator.model.dashscope.DashScopeTaskResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates DashScope task states into the vendor-neutral model.
 * {@code UNKNOWN} is what DashScope answers for ids it has never seen or has already expired.
 */
@Component
@Slf4j
public class DashScopeStatusMapper {

    public static final String STATUS_UNKNOWN = "UNKNOWN";
    public static final String CODE_DATA_INSPECTION_FAILED = "DataInspectionFailed";

    private static final Map<String, UpstreamStatus> TASK_STATUS = ImmutableMap.<String, UpstreamStatus>builder()
            .put("PENDING", UpstreamStatus.RUNNING)
            .put("RUNNING", UpstreamStatus.RUNNING)
            .put("SUCCEEDED", UpstreamStatus.SUCCESS)
            .put("FAILED", UpstreamStatus.GENERIC_FAILURE)
            .put("CANCELED", UpstreamStatus.UPSTREAM_CANCELLED)
            .build();

    public UpstreamStatus mapTaskStatus(String taskStatus, String errorCode) {
        UpstreamStatus status = taskStatus == null ? null : TASK_STATUS.get(taskStatus);
        if (status == null) {
            log.warn("Unknown DashScope task status {}, treating it as a failure.", taskStatus);
            return UpstreamStatus.GENERIC_FAILURE;
        }
        if (status == UpstreamStatus.GENERIC_FAILURE && isContentPolicy(errorCode)) {
            return UpstreamStatus.CONTENT_POLICY_REJECTED;
        }
        return status;
    }

    /**
     * @return empty for an {@code UNKNOWN} task or an answer without output
     */
    public Optional<PollObservation> toObservation(DashScopeTaskResponse response) {
        DashScopeTaskResponse.Output output = response.getOutput();
        if (output == null || STATUS_UNKNOWN.equals(output.getTaskStatus())) {
            return Optional.empty();
        }
        UpstreamStatus status = mapTaskStatus(output.getTaskStatus(), output.getCode());
        var builder = PollObservation.builder()
                .status(status)
                .upstreamCode(output.getCode() != null ? output.getTaskStatus() + "/" + output.getCode() : output.getTaskStatus())
                .upstreamMessage(output.getMessage());
        if (status == UpstreamStatus.SUCCESS) {
            builder.resultUrls(resultUrls(output));
        }
        return Optional.of(builder.build());
    }

    public SubmissionOutcome classifySubmission(DashScopeTaskResponse response) {
        if (response == null) {
            return SubmissionOutcome.rejected(FailureCategory.SUBMISSION_ERROR, "empty response");
        }
        String taskId = response.getOutput() != null ? response.getOutput().getTaskId() : null;
        if (taskId != null && !taskId.isBlank()) {
            return SubmissionOutcome.accepted(taskId);
        }
        String detail = "code=" + response.getCode() + ", msg=" + response.getMessage();
        if (isContentPolicy(response.getCode())) {
            return SubmissionOutcome.rejected(FailureCategory.CONTENT_POLICY_REJECTION, detail);
        }
        return SubmissionOutcome.rejected(FailureCategory.SUBMISSION_ERROR,
                response.getCode() == null ? "accepted without a task id" : detail);
    }

    public static boolean isContentPolicy(String errorCode) {
        return errorCode != null && errorCode.contains(CODE_DATA_INSPECTION_FAILED);
    }

    /**
     * {@code video_url} for video tasks; otherwise the {@code results[].url} entries that carry a URL, in order.
     */
    private static List<String> resultUrls(DashScopeTaskResponse.Output output) {
        List<String> urls = new ArrayList<>();
        if (output.getVideoUrl() != null && !output.getVideoUrl().isBlank()) {
            urls.add(output.getVideoUrl());
        }
        if (output.getResults() != null) {
            for (DashScopeTaskResponse.Result result : output.getResults()) {
                if (result != null && result.getUrl() != null && !result.getUrl().isBlank()) {
                    urls.add(result.getUrl());
                }
            }
        }
        return urls;
    }
}
