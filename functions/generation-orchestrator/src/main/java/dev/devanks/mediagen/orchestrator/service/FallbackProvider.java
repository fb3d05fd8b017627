package dev.devanks.mediagen.orchestrator.service;

import dev.devanks.mediagen.orchestrator.codec.MediaCodec;
import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.model.ErrorInfo;
import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import dev.devanks.mediagen.orchestrator.model.GenerationResult;
import dev.devanks.mediagen.orchestrator.model.ImageFrame;
import dev.devanks.mediagen.orchestrator.model.MediaPayload;
import dev.devanks.mediagen.orchestrator.model.OutputKind;
import dev.devanks.mediagen.orchestrator.model.VideoClip;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;

/**
 * Builds the placeholder result for every failure path. The placeholder has the same shape as a success
 * (one blank image or one empty clip), so callers never have to special-case a failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FallbackProvider {

    private final MediaCodec mediaCodec;
    private final DiagnosticMessages diagnosticMessages;

    public GenerationResult fallback(OutputKind outputKind, ErrorInfo error, String taskId, OrchestratorSettings settings) {
        FailureCategory category = error != null && error.getCategory() != null
                ? error.getCategory()
                : FailureCategory.UPSTREAM_FAILURE;
        String message = diagnostic(category, error, taskId, settings);
        log.warn("Returning placeholder for {} output: {}", outputKind, message);

        return GenerationResult.builder()
                .outputKind(outputKind)
                .asset(placeholder(outputKind, settings))
                .infoText(message)
                .usedFallback(true)
                .taskId(taskId)
                .failureCategory(category)
                .build();
    }

    private String diagnostic(FailureCategory category, ErrorInfo error, String taskId, OrchestratorSettings settings) {
        String detail = error != null && error.getDetail() != null ? error.getDetail() : "";
        String index = error != null && error.getAssetIndex() != null ? String.valueOf(error.getAssetIndex()) : "-";
        String task = taskId != null ? taskId : "-";
        return diagnosticMessages.text(category.getMessageKey(), category.getDefaultMessage(), settings.getLocale(),
                detail, task, index).trim();
    }

    private MediaPayload placeholder(OutputKind outputKind, OrchestratorSettings settings) {
        try {
            return mediaCodec.placeholder(outputKind, settings.getPlaceholderWidth(), settings.getPlaceholderHeight());
        } catch (RuntimeException e) {
            log.error("Codec could not build a placeholder, using a minimal one: {}", e.getMessage(), e);
            return outputKind == OutputKind.SINGLE_VIDEO
                    ? VideoClip.empty("mp4")
                    : new ImageFrame(new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB));
        }
    }
}
