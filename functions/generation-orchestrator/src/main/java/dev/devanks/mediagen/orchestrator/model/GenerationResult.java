package dev.devanks.mediagen.orchestrator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GenerationResult {

    @NonNull
    OutputKind outputKind;
    @Singular
    List<MediaPayload> assets;
    @Builder.Default
    String infoText = "";
    boolean usedFallback;
    String taskId;
    @Singular
    List<String> remoteUrls;
    FailureCategory failureCategory;
}
