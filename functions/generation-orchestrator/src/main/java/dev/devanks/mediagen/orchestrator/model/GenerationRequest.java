package dev.devanks.mediagen.orchestrator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GenerationRequest {

    @NonNull
    String modelKey;
    @Builder.Default
    String prompt = "";
    @NonNull
    OutputKind outputKind;
    @Builder.Default
    String aspectRatio = "16:9";
    @Builder.Default
    String resolution = "360p";
    @Builder.Default
    int durationSeconds = 5;
    @Builder.Default
    boolean audioEffect = false;
    @Builder.Default
    boolean hdMode = false;
    @Singular
    List<SourceAsset> references;

    public boolean hasReferences() {
        return !references.isEmpty();
    }
}
