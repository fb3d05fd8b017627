package dev.devanks.mediagen.orchestrator.model.dashscope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Answer of both the asynchronous submit endpoints and {@code /api/v1/tasks/{id}}.
 * A submit answer carries only {@code output.task_id} and {@code output.task_status}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class DashScopeTaskResponse {

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("output")
    private Output output;

    // set instead of output when the request itself is refused
    @JsonProperty("code")
    private String code;

    @JsonProperty("message")
    private String message;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Output {
        @JsonProperty("task_id")
        private String taskId;

        @JsonProperty("task_status")
        private String taskStatus; // PENDING, RUNNING, SUCCEEDED, FAILED, CANCELED, UNKNOWN

        @JsonProperty("video_url")
        private String videoUrl;

        @JsonProperty("results")
        private List<Result> results;

        @JsonProperty("code")
        private String code;

        @JsonProperty("message")
        private String message;

        @JsonProperty("submit_time")
        private String submitTime;

        @JsonProperty("end_time")
        private String endTime;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Result {
        @JsonProperty("url")
        private String url;

        @JsonProperty("code")
        private String code;

        @JsonProperty("message")
        private String message;
    }
}
