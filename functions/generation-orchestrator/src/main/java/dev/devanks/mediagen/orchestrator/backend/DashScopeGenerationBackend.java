package dev.devanks.mediagen.orchestrator.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.BaseEncoding;
import dev.devanks.mediagen.orchestrator.client.DashScopeApiClient;
import dev.devanks.mediagen.orchestrator.client.MediaTransferClient;
import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.exception.BackendException;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.mapper.DashScopeStatusMapper;
import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import dev.devanks.mediagen.orchestrator.model.PollObservation;
import dev.devanks.mediagen.orchestrator.model.SubmissionOutcome;
import dev.devanks.mediagen.orchestrator.model.Vendor;
import dev.devanks.mediagen.orchestrator.model.VendorSubmission;
import dev.devanks.mediagen.orchestrator.model.dashscope.DashScopeTaskResponse;
import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * DashScope (Qwen / Wan) asynchronous generation. References travel inline as data URIs, so there is no
 * upload round trip, and the API has no balance endpoint.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DashScopeGenerationBackend implements GenerationBackend {

    private final DashScopeApiClient dashScopeApiClient;
    private final MediaTransferClient mediaTransferClient;
    private final DashScopeStatusMapper statusMapper;

    @Override
    public Vendor vendor() {
        return Vendor.DASHSCOPE;
    }

    @Override
    public String uploadAsset(byte[] bytes, String fileName, String contentType, String scope,
                              OrchestratorSettings settings) {
        if (bytes.length == 0) {
            throw new BackendException("Reference " + fileName + " is empty");
        }
        log.debug("Inlining {} ({} bytes) as a data URI for {}.", fileName, bytes.length, scope);
        return "data:" + contentType + ";base64," + BaseEncoding.base64().encode(bytes);
    }

    @Override
    public SubmissionOutcome submit(VendorSubmission submission, OrchestratorSettings settings) {
        Map<String, String> headers = authHeaders(settings, true);
        DashScopeRoute route;
        try {
            route = DashScopeRoute.valueOf(submission.getRoute());
        } catch (IllegalArgumentException e) {
            return SubmissionOutcome.rejected(FailureCategory.SUBMISSION_ERROR, "unknown route " + submission.getRoute());
        }

        try {
            log.info("Submitting {} request ({}).", route, submission.getVariant());
            DashScopeTaskResponse response = send(route, headers, submission.getPayload());
            SubmissionOutcome outcome = statusMapper.classifySubmission(response);
            if (!outcome.isAccepted()) {
                log.warn("DashScope refused the {} submission: {}", route, outcome.getError().getDetail());
            }
            return outcome;
        } catch (FeignException e) {
            String body = e.contentUTF8();
            log.error("DashScope submit call failed (Feign): Status={}, Body={}", e.status(), body, e);
            FailureCategory category = DashScopeStatusMapper.isContentPolicy(body)
                    ? FailureCategory.CONTENT_POLICY_REJECTION
                    : FailureCategory.SUBMISSION_ERROR;
            return SubmissionOutcome.rejected(category, "HTTP " + e.status() + ": " + (body.isBlank() ? e.getMessage() : body));
        }
    }

    @Override
    public Optional<PollObservation> poll(String taskId, String routingKey, OrchestratorSettings settings) {
        Map<String, String> headers = authHeaders(settings, false);
        DashScopeTaskResponse response;
        try {
            response = dashScopeApiClient.task(headers, taskId);
        } catch (FeignException.NotFound e) {
            log.debug("DashScope does not know task {}.", taskId);
            return Optional.empty();
        } catch (FeignException e) {
            log.warn("DashScope task call failed (Feign): Status={}, Body={}", e.status(), e.contentUTF8());
            throw new BackendException("Task query for " + taskId + " failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new BackendException("Empty task response for " + taskId);
        }
        return statusMapper.toObservation(response);
    }

    @Override
    public boolean reportsBalance() {
        return false;
    }

    @Override
    public int queryBalance(OrchestratorSettings settings) {
        throw new BackendException("DashScope has no balance endpoint");
    }

    @Override
    public byte[] download(String url, OrchestratorSettings settings) {
        byte[] bytes;
        try {
            bytes = mediaTransferClient.download(URI.create(url), settings.getHeaders().get("user-agent"),
                    settings.getCallTimeout());
        } catch (RuntimeException e) { // WebClient errors, block() timeouts, malformed URLs
            log.error("Download of {} failed: {}", url, e.getMessage(), e);
            throw new BackendException("Download of " + url + " failed: " + e.getMessage(), e);
        }
        if (bytes.length == 0) {
            throw new BackendException("Download of " + url + " returned no bytes");
        }
        return bytes;
    }

    private DashScopeTaskResponse send(DashScopeRoute route, Map<String, String> headers, JsonNode payload) {
        return switch (route) {
            case VIDEO_SYNTHESIS -> dashScopeApiClient.submitVideoSynthesis(headers, payload);
            case KEYFRAME_VIDEO -> dashScopeApiClient.submitKeyframeVideo(headers, payload);
            case IMAGE_SYNTHESIS -> dashScopeApiClient.submitImageSynthesis(headers, payload);
        };
    }

    /**
     * @throws ConfigurationException when the snapshot has no usable API key
     */
    static Map<String, String> authHeaders(OrchestratorSettings settings, boolean async) {
        settings.requireCredentials(Vendor.DASHSCOPE);
        var headers = ImmutableMap.<String, String>builder()
                .put("Authorization", "Bearer " + settings.getDashScopeApiKey());
        if (async) {
            headers.put("X-DashScope-Async", "enable");
        }
        return headers.build();
    }
}
