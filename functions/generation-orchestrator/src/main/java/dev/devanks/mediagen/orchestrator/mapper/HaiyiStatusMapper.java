package dev.devanks.mediagen.orchestrator.mapper;

import com.google.common.collect.ImmutableMap;
import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import dev.devanks.mediagen.orchestrator.model.PollObservation;
import dev.devanks.mediagen.orchestrator.model.SubmissionOutcome;
import dev.devanks.mediagen.orchestrator.model.UpstreamStatus;
import dev.devanks.mediagen.orchestrator.model.haiyi.BatchProgress;
import dev.devanks.mediagen.orchestrator.model.haiyi.HaiyiResponse;
import dev.devanks.mediagen.orchestrator.model.haiyi.TaskCreated;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Translates Haiyi response codes into the vendor-neutral model. Pure lookups, no state.
 */
@Component
@Slf4j
public class HaiyiStatusMapper {

    private static final Map<Integer, UpstreamStatus> ITEM_STATUS = ImmutableMap.<Integer, UpstreamStatus>builder()
            .put(1, UpstreamStatus.RUNNING)
            .put(2, UpstreamStatus.RUNNING)
            .put(3, UpstreamStatus.SUCCESS)
            .put(4, UpstreamStatus.UPSTREAM_CANCELLED)
            .put(5, UpstreamStatus.GENERIC_FAILURE)
            .put(HaiyiResponse.CODE_SENSITIVE_CONTENT, UpstreamStatus.CONTENT_POLICY_REJECTED)
            .build();

    public UpstreamStatus mapItemStatus(Integer code) {
        UpstreamStatus status = code == null ? null : ITEM_STATUS.get(code);
        if (status == null) {
            log.warn("Unknown Haiyi task status {}, treating it as a failure.", code);
            return UpstreamStatus.GENERIC_FAILURE;
        }
        return status;
    }

    public PollObservation toObservation(BatchProgress.Item item) {
        UpstreamStatus status = mapItemStatus(item.getStatus());
        var builder = PollObservation.builder()
                .status(status)
                .progress(item.getProcess())
                .upstreamCode(String.valueOf(item.getStatus()));
        if (status == UpstreamStatus.SUCCESS) {
            builder.resultUrls(orderedResultUrls(item.getImgUris()));
        }
        return builder.build();
    }

    public SubmissionOutcome classifySubmission(HaiyiResponse<TaskCreated> response) {
        if (response == null) {
            return SubmissionOutcome.rejected(FailureCategory.SUBMISSION_ERROR, "empty response");
        }
        Integer code = response.code();
        if (response.isOk()) {
            String taskId = response.getData() != null ? response.getData().getId() : null;
            if (taskId == null || taskId.isBlank()) {
                return SubmissionOutcome.rejected(FailureCategory.SUBMISSION_ERROR, "accepted without a task id");
            }
            return SubmissionOutcome.accepted(taskId);
        }
        if (Integer.valueOf(HaiyiResponse.CODE_SENSITIVE_CONTENT).equals(code)) {
            return SubmissionOutcome.rejected(FailureCategory.CONTENT_POLICY_REJECTION,
                    "code=" + code + ", msg=" + response.message());
        }
        return SubmissionOutcome.rejected(FailureCategory.SUBMISSION_ERROR, "code=" + code + ", msg=" + response.message());
    }

    /**
     * Indexed entries first in index order, then any entries without an index in response order.
     * {@code url} wins over {@code cover_url}.
     */
    private List<String> orderedResultUrls(List<BatchProgress.ImageUri> uris) {
        if (uris == null) {
            return List.of();
        }
        List<BatchProgress.ImageUri> indexed = new ArrayList<>();
        List<BatchProgress.ImageUri> unindexed = new ArrayList<>();
        for (BatchProgress.ImageUri uri : uris) {
            if (uri == null) {
                continue;
            }
            (uri.getIndex() != null ? indexed : unindexed).add(uri);
        }
        indexed.sort(Comparator.comparing(BatchProgress.ImageUri::getIndex));

        List<String> urls = new ArrayList<>();
        for (BatchProgress.ImageUri uri : concat(indexed, unindexed)) {
            String url = uri.getUrl() != null && !uri.getUrl().isBlank() ? uri.getUrl() : uri.getCoverUrl();
            if (url != null && !url.isBlank()) {
                urls.add(url);
            }
        }
        return urls;
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        List<T> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }
}
