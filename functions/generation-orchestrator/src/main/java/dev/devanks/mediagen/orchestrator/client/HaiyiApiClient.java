// functions/generation-orchestrator/src/main/java/dev/devanks/mediagen/orchestrator/client/HaiyiApiClient.java
package dev.devanks.mediagen.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import dev.devanks.mediagen.orchestrator.config.HaiyiApiClientConfig;
import dev.devanks.mediagen.orchestrator.model.haiyi.AccountAssets;
import dev.devanks.mediagen.orchestrator.model.haiyi.BatchProgress;
import dev.devanks.mediagen.orchestrator.model.haiyi.BatchProgressRequest;
import dev.devanks.mediagen.orchestrator.model.haiyi.ConfirmUploadRequest;
import dev.devanks.mediagen.orchestrator.model.haiyi.ConfirmedUpload;
import dev.devanks.mediagen.orchestrator.model.haiyi.HaiyiResponse;
import dev.devanks.mediagen.orchestrator.model.haiyi.PresignRequest;
import dev.devanks.mediagen.orchestrator.model.haiyi.PresignedUpload;
import dev.devanks.mediagen.orchestrator.model.haiyi.TaskCreated;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

import java.util.Map;

/**
 * Feign client for the Haiyi task platform.
 * Every call carries the session cookie and platform headers of the calling invocation; timeouts come
 * from HaiyiApiClientConfig.
 */
@FeignClient(name = "haiyi-api",
        url = "${orchestrator.haiyi.base-url}",
        configuration = HaiyiApiClientConfig.class)
public interface HaiyiApiClient {

    @PostMapping("/api/v1/task/v2/text-to-img")
    HaiyiResponse<TaskCreated> submitTextToImage(@RequestHeader Map<String, String> headers, @RequestBody JsonNode payload);

    @PostMapping("/api/v1/creativity/generate/apply")
    HaiyiResponse<TaskCreated> submitApply(@RequestHeader Map<String, String> headers, @RequestBody JsonNode payload);

    @PostMapping("/api/v1/task/v2/video/text-to-video")
    HaiyiResponse<TaskCreated> submitTextToVideo(@RequestHeader Map<String, String> headers, @RequestBody JsonNode payload);

    @PostMapping("/api/v1/task/v2/video/img-to-video")
    HaiyiResponse<TaskCreated> submitImageToVideo(@RequestHeader Map<String, String> headers, @RequestBody JsonNode payload);

    @PostMapping("/api/v1/task/v2/video/multi-img-to-video")
    HaiyiResponse<TaskCreated> submitMultiImageToVideo(@RequestHeader Map<String, String> headers, @RequestBody JsonNode payload);

    @PostMapping("/api/v1/task/batch-progress")
    HaiyiResponse<BatchProgress> batchProgress(@RequestHeader Map<String, String> headers, @RequestBody BatchProgressRequest request);

    @PostMapping("/api/v1/resource/uploadImageByPreSign")
    HaiyiResponse<PresignedUpload> presignUpload(@RequestHeader Map<String, String> headers, @RequestBody PresignRequest request);

    @PostMapping("/api/v1/resource/confirmImageUploadedByPreSign")
    HaiyiResponse<ConfirmedUpload> confirmUpload(@RequestHeader Map<String, String> headers, @RequestBody ConfirmUploadRequest request);

    // The endpoint expects an empty JSON object
    @PostMapping("/api/v1/payment/assets/get")
    HaiyiResponse<AccountAssets> accountAssets(@RequestHeader Map<String, String> headers, @RequestBody Map<String, Object> emptyBody);
}
