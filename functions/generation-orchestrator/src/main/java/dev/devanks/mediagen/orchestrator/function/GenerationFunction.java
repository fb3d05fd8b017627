package dev.devanks.mediagen.orchestrator.function;

import dev.devanks.mediagen.orchestrator.config.SettingsStore;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.mapper.GenerationReportMapper;
import dev.devanks.mediagen.orchestrator.mapper.GenerationRequestMapper;
import dev.devanks.mediagen.orchestrator.model.GenerationPayload;
import dev.devanks.mediagen.orchestrator.model.GenerationReport;
import dev.devanks.mediagen.orchestrator.model.GenerationRequest;
import dev.devanks.mediagen.orchestrator.model.GenerationResult;
import dev.devanks.mediagen.orchestrator.model.StatusQuery;
import dev.devanks.mediagen.orchestrator.model.Vendor;
import dev.devanks.mediagen.orchestrator.service.GenerationOrchestrator;
import dev.devanks.mediagen.orchestrator.service.TaskStatusQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.function.Function;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
@Slf4j
public class GenerationFunction {

    private final GenerationOrchestrator generationOrchestrator;
    private final TaskStatusQueryService taskStatusQueryService;
    private final GenerationRequestMapper requestMapper;
    private final GenerationReportMapper reportMapper;
    private final SettingsStore settingsStore;

    /**
     * Main function bean: runs one generation. Configuration problems and malformed payloads come back as an
     * ERROR report; every other failure is already a FALLBACK report.
     */
    @Bean
    public Function<GenerationPayload, GenerationReport> generateMedia() {
        return payload -> {
            log.info("generateMedia triggered for model {}.", payload != null ? payload.getModel() : null);
            try {
                GenerationRequest request = requestMapper.toRequest(payload);
                GenerationResult result = generationOrchestrator.generate(request);
                return reportMapper.toReport(result);
            } catch (ConfigurationException e) {
                log.error("Configuration error: {}", e.getMessage());
                return reportMapper.toErrorReport("Configuration error: " + e.getMessage());
            } catch (IllegalArgumentException e) {
                log.error("Invalid generateMedia payload: {}", e.getMessage());
                return reportMapper.toErrorReport("Invalid request: " + e.getMessage());
            }
        };
    }

    /**
     * Looks up a task. Expects {@code taskId}; optionally {@code vendor} (haiyi or dashscope), {@code ss} for
     * Haiyi, and {@code autoRefresh}, {@code refreshInterval}, {@code maxRefreshCount} to keep checking a
     * running task.
     */
    @Bean
    public Function<HashMap<String, Object>, String> checkGenerationTask() {
        return payload -> {
            if (payload == null || payload.get("taskId") == null) {
                return "Error: payload must contain 'taskId'.";
            }
            String taskId = String.valueOf(payload.get("taskId"));
            try {
                StatusQuery.StatusQueryBuilder query = StatusQuery.builder()
                        .taskId(taskId)
                        .vendor(Vendor.fromName(stringValue(payload.get("vendor"))))
                        .routingKey(stringValue(payload.get("ss")));
                if (payload.get("autoRefresh") != null) {
                    query.autoRefresh(Boolean.parseBoolean(String.valueOf(payload.get("autoRefresh"))));
                }
                if (payload.get("refreshInterval") != null) {
                    query.refreshIntervalSeconds(intValue("refreshInterval", payload.get("refreshInterval")));
                }
                if (payload.get("maxRefreshCount") != null) {
                    query.maxRefreshCount(intValue("maxRefreshCount", payload.get("maxRefreshCount")));
                }
                return taskStatusQueryService.check(query.build());
            } catch (ConfigurationException | IllegalArgumentException e) {
                log.error("checkGenerationTask failed for {}: {}", taskId, e.getMessage());
                return "Error: " + e.getMessage();
            }
        };
    }

    /**
     * Rebinds the settings. An invalid configuration is reported and the running settings stay in place.
     */
    @Bean
    public Supplier<String> reloadOrchestratorSettings() {
        return () -> {
            try {
                var settings = settingsStore.reload();
                return "Settings reloaded, " + settings.getModels().size() + " model(s) configured.";
            } catch (ConfigurationException e) {
                log.error("Settings reload rejected: {}", e.getMessage());
                return "Error: " + e.getMessage();
            }
        };
    }

    private static String stringValue(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    private static int intValue(String field, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " must be a whole number, got " + value, e);
        }
    }
}
