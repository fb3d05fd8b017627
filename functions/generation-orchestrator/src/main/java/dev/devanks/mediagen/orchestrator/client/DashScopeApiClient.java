package dev.devanks.mediagen.orchestrator.client;

import com.fasterxml.jackson.databind.JsonNode;
import dev.devanks.mediagen.orchestrator.config.DashScopeApiClientConfig;
import dev.devanks.mediagen.orchestrator.model.dashscope.DashScopeTaskResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

import java.util.Map;

/**
 * Feign client for the asynchronous DashScope (Qwen / Wan) generation endpoints.
 * Submissions need {@code X-DashScope-Async: enable}; every call needs the bearer token.
 */
@FeignClient(name = "dashscope-api",
        url = "${orchestrator.dashscope.base-url}",
        configuration = DashScopeApiClientConfig.class)
public interface DashScopeApiClient {

    @PostMapping("/api/v1/services/aigc/video-generation/video-synthesis")
    DashScopeTaskResponse submitVideoSynthesis(@RequestHeader Map<String, String> headers, @RequestBody JsonNode payload);

    @PostMapping("/api/v1/services/aigc/image2video/video-synthesis")
    DashScopeTaskResponse submitKeyframeVideo(@RequestHeader Map<String, String> headers, @RequestBody JsonNode payload);

    @PostMapping("/api/v1/services/aigc/text2image/image-synthesis")
    DashScopeTaskResponse submitImageSynthesis(@RequestHeader Map<String, String> headers, @RequestBody JsonNode payload);

    @GetMapping("/api/v1/tasks/{taskId}")
    DashScopeTaskResponse task(@RequestHeader Map<String, String> headers, @PathVariable("taskId") String taskId);
}
