package dev.devanks.mediagen.orchestrator.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;
import dev.devanks.mediagen.orchestrator.client.HaiyiApiClient;
import dev.devanks.mediagen.orchestrator.client.MediaTransferClient;
import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.exception.BackendException;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.mapper.HaiyiStatusMapper;
import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import dev.devanks.mediagen.orchestrator.model.PollObservation;
import dev.devanks.mediagen.orchestrator.model.SubmissionOutcome;
import dev.devanks.mediagen.orchestrator.model.UpstreamStatus;
import dev.devanks.mediagen.orchestrator.model.Vendor;
import dev.devanks.mediagen.orchestrator.model.VendorSubmission;
import dev.devanks.mediagen.orchestrator.model.haiyi.BatchProgress;
import dev.devanks.mediagen.orchestrator.model.haiyi.BatchProgressRequest;
import dev.devanks.mediagen.orchestrator.model.haiyi.ConfirmUploadRequest;
import dev.devanks.mediagen.orchestrator.model.haiyi.ConfirmedUpload;
import dev.devanks.mediagen.orchestrator.model.haiyi.HaiyiResponse;
import dev.devanks.mediagen.orchestrator.model.haiyi.PresignRequest;
import dev.devanks.mediagen.orchestrator.model.haiyi.PresignedUpload;
import dev.devanks.mediagen.orchestrator.model.haiyi.TaskCreated;
import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class HaiyiGenerationBackend implements GenerationBackend {

    private final HaiyiApiClient haiyiApiClient;
    private final MediaTransferClient mediaTransferClient;
    private final HaiyiStatusMapper statusMapper;

    @Override
    public Vendor vendor() {
        return Vendor.HAIYI;
    }

    @Override
    public String uploadAsset(byte[] bytes, String fileName, String contentType, String scope,
                              OrchestratorSettings settings) {
        Map<String, String> headers = sessionHeaders(settings);
        try {
            PresignRequest presignRequest = PresignRequest.builder()
                    .contentType(contentType)
                    .fileName(fileName)
                    .fileSize(bytes.length)
                    .category(PresignRequest.CATEGORY_REFERENCE_IMAGE)
                    .hashVal(Hashing.sha256().hashBytes(bytes).toString())
                    .templateId(scope)
                    .build();
            HaiyiResponse<PresignedUpload> presigned = haiyiApiClient.presignUpload(headers, presignRequest);
            PresignedUpload upload = requireOk(presigned, "presign upload");
            if (upload.getPreSign() == null || upload.getFileId() == null) {
                throw new BackendException("Presign response for " + fileName + " is missing pre_sign or file_id");
            }

            mediaTransferClient.upload(URI.create(upload.getPreSign()), bytes, contentType,
                    settings.getHeaders(), settings.getCallTimeout());

            HaiyiResponse<ConfirmedUpload> confirmed = haiyiApiClient.confirmUpload(headers,
                    new ConfirmUploadRequest(PresignRequest.CATEGORY_REFERENCE_IMAGE, upload.getFileId(), scope));
            String url = requireOk(confirmed, "confirm upload").getUrl();
            if (url == null || url.isBlank()) {
                throw new BackendException("Upload of " + fileName + " was confirmed without a URL");
            }
            return url;
        } catch (FeignException e) {
            log.error("Haiyi upload call failed (Feign): Status={}, Body={}", e.status(), e.contentUTF8(), e);
            throw new BackendException("Upload of " + fileName + " failed: " + e.getMessage(), e);
        } catch (BackendException e) {
            throw e;
        } catch (RuntimeException e) { // WebClient errors, block() timeouts, malformed presigned URLs
            log.error("Presigned PUT of {} failed: {}", fileName, e.getMessage(), e);
            throw new BackendException("Upload of " + fileName + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public SubmissionOutcome submit(VendorSubmission submission, OrchestratorSettings settings) {
        Map<String, String> headers = sessionHeaders(settings);
        HaiyiRoute route;
        try {
            route = HaiyiRoute.valueOf(submission.getRoute());
        } catch (IllegalArgumentException e) {
            return SubmissionOutcome.rejected(FailureCategory.SUBMISSION_ERROR, "unknown route " + submission.getRoute());
        }

        try {
            log.info("Submitting {} request ({}).", route, submission.getVariant());
            HaiyiResponse<TaskCreated> response = send(route, headers, submission.getPayload());
            SubmissionOutcome outcome = statusMapper.classifySubmission(response);
            if (!outcome.isAccepted()) {
                log.warn("Haiyi refused the {} submission: {}", route, outcome.getError().getDetail());
            }
            return outcome;
        } catch (FeignException e) {
            log.error("Haiyi submit call failed (Feign): Status={}, Body={}", e.status(), e.contentUTF8(), e);
            return SubmissionOutcome.rejected(FailureCategory.SUBMISSION_ERROR, "HTTP " + e.status() + ": " + e.getMessage());
        }
    }

    @Override
    public Optional<PollObservation> poll(String taskId, String routingKey, OrchestratorSettings settings) {
        Map<String, String> headers = sessionHeaders(settings);
        int ss = routingKey != null ? parseShard(routingKey) : settings.getDefaultSs();
        HaiyiResponse<BatchProgress> response;
        try {
            response = haiyiApiClient.batchProgress(headers, new BatchProgressRequest(List.of(taskId), ss));
        } catch (FeignException e) {
            log.warn("Haiyi progress call failed (Feign): Status={}, Body={}", e.status(), e.contentUTF8());
            throw new BackendException("Progress query for task " + taskId + " failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new BackendException("Empty progress response for task " + taskId);
        }
        if (Integer.valueOf(HaiyiResponse.CODE_SENSITIVE_CONTENT).equals(response.code())) {
            return Optional.of(PollObservation.builder()
                    .status(UpstreamStatus.CONTENT_POLICY_REJECTED)
                    .upstreamCode(String.valueOf(response.code()))
                    .build());
        }
        if (!response.isOk()) {
            throw new BackendException("Progress query for task " + taskId + " returned code="
                    + response.code() + ", msg=" + response.message());
        }

        List<BatchProgress.Item> items = response.getData() != null ? response.getData().getItems() : null;
        if (items == null || items.isEmpty()) {
            return Optional.empty();
        }
        BatchProgress.Item item = items.stream()
                .filter(candidate -> taskId.equals(candidate.getId()))
                .findFirst()
                .orElse(items.get(0));
        return Optional.of(statusMapper.toObservation(item));
    }

    @Override
    public int queryBalance(OrchestratorSettings settings) {
        Map<String, String> headers = sessionHeaders(settings);
        try {
            var response = haiyiApiClient.accountAssets(headers, Map.of());
            var assets = requireOk(response, "account assets");
            if (assets.getTempCoins() == null) {
                throw new BackendException("Account assets response has no temp_coins");
            }
            return assets.getTempCoins();
        } catch (FeignException e) {
            log.warn("Haiyi balance call failed (Feign): Status={}, Body={}", e.status(), e.contentUTF8());
            throw new BackendException("Balance query failed: " + e.getMessage(), e);
        }
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

    private HaiyiResponse<TaskCreated> send(HaiyiRoute route, Map<String, String> headers, JsonNode payload) {
        return switch (route) {
            case TEXT_TO_IMAGE -> haiyiApiClient.submitTextToImage(headers, payload);
            case APPLY -> haiyiApiClient.submitApply(headers, payload);
            case TEXT_TO_VIDEO -> haiyiApiClient.submitTextToVideo(headers, payload);
            case IMAGE_TO_VIDEO -> haiyiApiClient.submitImageToVideo(headers, payload);
            case MULTI_IMAGE_TO_VIDEO -> haiyiApiClient.submitMultiImageToVideo(headers, payload);
        };
    }

    /**
     * Platform headers plus the session cookie of the given snapshot.
     *
     * @throws ConfigurationException when the snapshot has no usable cookie
     */
    static Map<String, String> sessionHeaders(OrchestratorSettings settings) {
        settings.requireCredentials(Vendor.HAIYI);
        return ImmutableMap.<String, String>builder()
                .putAll(settings.getHeaders())
                .put("Cookie", settings.getCookie())
                .build();
    }

    private static <T> T requireOk(HaiyiResponse<T> response, String call) {
        if (response == null) {
            throw new BackendException("Empty response from " + call);
        }
        if (!response.isOk() || response.getData() == null) {
            throw new BackendException(call + " returned code=" + response.code() + ", msg=" + response.message());
        }
        return response.getData();
    }

    private static int parseShard(String routingKey) {
        try {
            return Integer.parseInt(routingKey.trim());
        } catch (NumberFormatException e) {
            throw new BackendException("Routing key is not a Haiyi shard: " + routingKey, e);
        }
    }
}
