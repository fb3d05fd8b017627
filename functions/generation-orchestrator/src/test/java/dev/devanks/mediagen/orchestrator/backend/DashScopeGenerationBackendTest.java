package dev.devanks.mediagen.orchestrator.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.devanks.mediagen.orchestrator.TestFixtures;
import dev.devanks.mediagen.orchestrator.client.DashScopeApiClient;
import dev.devanks.mediagen.orchestrator.client.MediaTransferClient;
import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.exception.BackendException;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.mapper.DashScopeStatusMapper;
import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import dev.devanks.mediagen.orchestrator.model.PollObservation;
import dev.devanks.mediagen.orchestrator.model.SubmissionOutcome;
import dev.devanks.mediagen.orchestrator.model.SubmissionVariant;
import dev.devanks.mediagen.orchestrator.model.UpstreamStatus;
import dev.devanks.mediagen.orchestrator.model.VendorSubmission;
import dev.devanks.mediagen.orchestrator.model.dashscope.DashScopeTaskResponse;
import feign.FeignException;
import feign.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DashScopeGenerationBackend Unit Tests")
class DashScopeGenerationBackendTest {

    @Mock
    private DashScopeApiClient mockApiClient;
    @Mock
    private MediaTransferClient mockTransferClient;

    @Captor
    private ArgumentCaptor<Map<String, String>> headersCaptor;

    private DashScopeGenerationBackend backend;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OrchestratorSettings settings = TestFixtures.settings();

    @BeforeEach
    void setUp() {
        backend = new DashScopeGenerationBackend(mockApiClient, mockTransferClient, new DashScopeStatusMapper());
    }

    @Test
    @DisplayName("uploadAsset: the image is inlined as a base64 data URI without any network call")
    void uploadAsset_dataUri() {
        byte[] bytes = TestFixtures.png(4, 4);

        String url = backend.uploadAsset(bytes, "reference-0.png", "image/png", "wan2.2-i2v-plus", settings);

        assertThat(url).startsWith("data:image/png;base64,");
        assertThat(Base64.getDecoder().decode(url.substring("data:image/png;base64,".length()))).isEqualTo(bytes);
        verifyNoInteractions(mockApiClient, mockTransferClient);
    }

    @Test
    @DisplayName("uploadAsset: empty bytes are a backend error")
    void uploadAsset_empty() {
        assertThatThrownBy(() -> backend.uploadAsset(new byte[0], "reference-0.png", "image/png", "scope", settings))
                .isInstanceOf(BackendException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("submit: bearer key and async header are sent and the task id is returned")
    void submit_accepted() {
        // Arrange
        ObjectNode payload = objectMapper.createObjectNode().put("model", "wan2.2-i2v-plus");
        when(mockApiClient.submitVideoSynthesis(headersCaptor.capture(), eq(payload)))
                .thenReturn(taskResponse("task-1", "PENDING", null));

        // Act
        SubmissionOutcome outcome = backend.submit(submission(DashScopeRoute.VIDEO_SYNTHESIS, payload), settings);

        // Assert
        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.getTaskId()).isEqualTo("task-1");
        assertThat(headersCaptor.getValue())
                .containsEntry("Authorization", "Bearer " + TestFixtures.DASHSCOPE_API_KEY)
                .containsEntry("X-DashScope-Async", "enable");
        verify(mockApiClient, never()).submitKeyframeVideo(anyMap(), any());
    }

    @Test
    @DisplayName("submit: each route goes to its own endpoint")
    void submit_routes() {
        ObjectNode payload = objectMapper.createObjectNode();
        when(mockApiClient.submitKeyframeVideo(anyMap(), eq(payload))).thenReturn(taskResponse("kf-1", "PENDING", null));
        when(mockApiClient.submitImageSynthesis(anyMap(), eq(payload))).thenReturn(taskResponse("img-1", "PENDING", null));

        assertThat(backend.submit(submission(DashScopeRoute.KEYFRAME_VIDEO, payload), settings).getTaskId())
                .isEqualTo("kf-1");
        assertThat(backend.submit(submission(DashScopeRoute.IMAGE_SYNTHESIS, payload), settings).getTaskId())
                .isEqualTo("img-1");
    }

    @Test
    @DisplayName("submit: an HTTP 400 with DataInspectionFailed is a content-policy rejection")
    void submit_dataInspectionFailed() {
        ObjectNode payload = objectMapper.createObjectNode();
        when(mockApiClient.submitVideoSynthesis(anyMap(), eq(payload))).thenThrow(badRequest(
                "{\"code\":\"DataInspectionFailed\",\"message\":\"Input data may contain inappropriate content.\"}"));

        SubmissionOutcome outcome = backend.submit(submission(DashScopeRoute.VIDEO_SYNTHESIS, payload), settings);

        assertThat(outcome.isAccepted()).isFalse();
        assertThat(outcome.getError().getCategory()).isEqualTo(FailureCategory.CONTENT_POLICY_REJECTION);
        assertThat(outcome.getError().getDetail()).contains("400").contains("inappropriate");
    }

    @Test
    @DisplayName("submit: other HTTP errors are submission errors carrying the body")
    void submit_httpError() {
        ObjectNode payload = objectMapper.createObjectNode();
        when(mockApiClient.submitVideoSynthesis(anyMap(), eq(payload)))
                .thenThrow(badRequest("{\"code\":\"InvalidParameter\",\"message\":\"size is invalid\"}"));

        SubmissionOutcome outcome = backend.submit(submission(DashScopeRoute.VIDEO_SYNTHESIS, payload), settings);

        assertThat(outcome.getError().getCategory()).isEqualTo(FailureCategory.SUBMISSION_ERROR);
        assertThat(outcome.getError().getDetail()).contains("InvalidParameter");
    }

    @Test
    @DisplayName("submit: unknown route is rejected without a call")
    void submit_unknownRoute() {
        VendorSubmission submission = VendorSubmission.builder()
                .route("TEXT_TO_VIDEO")
                .payload(objectMapper.createObjectNode())
                .variant(SubmissionVariant.TEXT_ONLY)
                .build();

        SubmissionOutcome outcome = backend.submit(submission, settings);

        assertThat(outcome.getError().getCategory()).isEqualTo(FailureCategory.SUBMISSION_ERROR);
        verifyNoInteractions(mockApiClient);
    }

    @Test
    @DisplayName("submit: a snapshot without an API key fails before any call")
    void submit_missingApiKey() {
        OrchestratorSettings withoutKey = settings.toBuilder().dashScopeApiKey("").build();

        assertThatThrownBy(() -> backend.submit(
                submission(DashScopeRoute.VIDEO_SYNTHESIS, objectMapper.createObjectNode()), withoutKey))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("api-key");
        verifyNoInteractions(mockApiClient);
    }

    @Test
    @DisplayName("poll: the query is synchronous and a finished video is mapped with its URL")
    void poll_succeeded() {
        // Arrange
        DashScopeTaskResponse response = taskResponse("task-1", "SUCCEEDED", null);
        response.getOutput().setVideoUrl("https://dashscope-result/v.mp4");
        when(mockApiClient.task(headersCaptor.capture(), eq("task-1"))).thenReturn(response);

        // Act
        Optional<PollObservation> observation = backend.poll("task-1", null, settings);

        // Assert
        assertThat(observation).hasValueSatisfying(value -> {
            assertThat(value.getStatus()).isEqualTo(UpstreamStatus.SUCCESS);
            assertThat(value.getResultUrls()).containsExactly("https://dashscope-result/v.mp4");
        });
        assertThat(headersCaptor.getValue())
                .containsEntry("Authorization", "Bearer " + TestFixtures.DASHSCOPE_API_KEY)
                .doesNotContainKey("X-DashScope-Async");
    }

    @Test
    @DisplayName("poll: HTTP 404 and UNKNOWN both mean the task is not known")
    void poll_notFound() {
        when(mockApiClient.task(anyMap(), eq("gone"))).thenThrow(new FeignException.NotFound("not found", request(),
                null, Collections.emptyMap()));
        when(mockApiClient.task(anyMap(), eq("expired"))).thenReturn(taskResponse("expired", "UNKNOWN", null));

        assertThat(backend.poll("gone", null, settings)).isEmpty();
        assertThat(backend.poll("expired", null, settings)).isEmpty();
    }

    @Test
    @DisplayName("poll: other transport failures are thrown as BackendException")
    void poll_transportFailure() {
        when(mockApiClient.task(anyMap(), eq("task-1"))).thenThrow(new FeignException.ServiceUnavailable("down",
                request(), null, Collections.emptyMap()));

        assertThatThrownBy(() -> backend.poll("task-1", null, settings)).isInstanceOf(BackendException.class);
    }

    @Test
    @DisplayName("queryBalance: DashScope reports no balance")
    void queryBalance_unsupported() {
        assertThat(backend.reportsBalance()).isFalse();
        assertThatThrownBy(() -> backend.queryBalance(settings)).isInstanceOf(BackendException.class);
    }

    @Test
    @DisplayName("download: bytes come through the transfer client with the configured user agent")
    void download_success() {
        when(mockTransferClient.download(URI.create("https://dashscope-result/v.mp4"),
                settings.getHeaders().get("user-agent"), settings.getCallTimeout())).thenReturn(new byte[]{7, 7});

        assertThat(backend.download("https://dashscope-result/v.mp4", settings)).containsExactly(7, 7);
    }

    private static VendorSubmission submission(DashScopeRoute route, ObjectNode payload) {
        return VendorSubmission.builder()
                .route(route.name())
                .payload(payload)
                .variant(SubmissionVariant.TEXT_ONLY)
                .build();
    }

    private static DashScopeTaskResponse taskResponse(String taskId, String status, String code) {
        return DashScopeTaskResponse.builder()
                .requestId("req-1")
                .output(DashScopeTaskResponse.Output.builder()
                        .taskId(taskId)
                        .taskStatus(status)
                        .code(code)
                        .results(List.of())
                        .build())
                .build();
    }

    private static FeignException badRequest(String body) {
        return new FeignException.BadRequest("Bad Request", request(), body.getBytes(StandardCharsets.UTF_8),
                Collections.emptyMap());
    }

    private static Request request() {
        return Request.create(Request.HttpMethod.POST, "/fake", Collections.emptyMap(), null,
                StandardCharsets.UTF_8, null);
    }
}
