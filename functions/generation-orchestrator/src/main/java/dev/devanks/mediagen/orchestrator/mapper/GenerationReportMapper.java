package dev.devanks.mediagen.orchestrator.mapper;

import dev.devanks.mediagen.orchestrator.model.GenerationReport;
import dev.devanks.mediagen.orchestrator.model.GenerationResult;
import dev.devanks.mediagen.orchestrator.model.ImageFrame;
import dev.devanks.mediagen.orchestrator.model.MediaPayload;
import org.springframework.stereotype.Component;

@Component
public class GenerationReportMapper {

    public GenerationReport toReport(GenerationResult result) {
        var builder = GenerationReport.builder()
                .status(result.isUsedFallback() ? GenerationReport.Status.FALLBACK : GenerationReport.Status.SUCCESS)
                .usedFallback(result.isUsedFallback())
                .infoText(result.getInfoText())
                .outputKind(result.getOutputKind())
                .assetCount(result.getAssets().size())
                .taskId(result.getTaskId())
                .failureCategory(result.getFailureCategory())
                .remoteUrls(result.getRemoteUrls());

        if (!result.getAssets().isEmpty()) {
            MediaPayload first = result.getAssets().get(0);
            if (first instanceof ImageFrame frame) {
                builder.width(frame.getWidth()).height(frame.getHeight());
            }
        }
        return builder.build();
    }

    public GenerationReport toErrorReport(String message) {
        return GenerationReport.builder()
                .status(GenerationReport.Status.ERROR)
                .usedFallback(false)
                .infoText(message)
                .assetCount(0)
                .build();
    }
}
