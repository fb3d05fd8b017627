package dev.devanks.mediagen.orchestrator.mapper;

import com.google.common.io.BaseEncoding;
import dev.devanks.mediagen.orchestrator.config.SettingsStore;
import dev.devanks.mediagen.orchestrator.model.GenerationPayload;
import dev.devanks.mediagen.orchestrator.model.GenerationRequest;
import dev.devanks.mediagen.orchestrator.model.OutputKind;
import dev.devanks.mediagen.orchestrator.model.SourceAsset;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class GenerationRequestMapper {

    private final SettingsStore settingsStore;

    /**
     * @throws IllegalArgumentException when the payload has no model or a reference is not valid base64
     * @throws dev.devanks.mediagen.orchestrator.exception.ConfigurationException when the output kind is left
     *                                                                           out and the model is unknown
     */
    public GenerationRequest toRequest(GenerationPayload payload) {
        if (payload == null || payload.getModel() == null || payload.getModel().isBlank()) {
            throw new IllegalArgumentException("Payload must name a model");
        }
        String modelKey = payload.getModel().trim();
        OutputKind outputKind = payload.getOutputKind() != null
                ? payload.getOutputKind()
                : settingsStore.current().model(modelKey).getOutput();

        var builder = GenerationRequest.builder()
                .modelKey(modelKey)
                .outputKind(outputKind);
        if (payload.getPrompt() != null) {
            builder.prompt(payload.getPrompt());
        }
        if (payload.getAspectRatio() != null) {
            builder.aspectRatio(payload.getAspectRatio());
        }
        if (payload.getResolution() != null) {
            builder.resolution(payload.getResolution());
        }
        if (payload.getDurationSeconds() != null) {
            builder.durationSeconds(payload.getDurationSeconds());
        }
        if (payload.getAudioEffect() != null) {
            builder.audioEffect(payload.getAudioEffect());
        }
        if (payload.getHdMode() != null) {
            builder.hdMode(payload.getHdMode());
        }

        List<GenerationPayload.Reference> references = payload.getReferences() != null ? payload.getReferences() : List.of();
        for (int i = 0; i < references.size(); i++) {
            builder.reference(toSourceAsset(i, references.get(i)));
        }
        return builder.build();
    }

    private static SourceAsset toSourceAsset(int index, GenerationPayload.Reference reference) {
        if (reference == null || reference.getBase64() == null || reference.getBase64().isBlank()) {
            throw new IllegalArgumentException("Reference " + index + " has no image data");
        }
        String encoded = reference.getBase64().trim();
        int comma = encoded.indexOf(',');
        if (encoded.startsWith("data:") && comma > 0) {
            encoded = encoded.substring(comma + 1);
        }
        byte[] bytes;
        try {
            bytes = BaseEncoding.base64().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Reference " + index + " is not valid base64", e);
        }
        String name = reference.getName() != null && !reference.getName().isBlank()
                ? reference.getName()
                : "reference-" + index;
        return SourceAsset.builder().sourceRef(name).bytes(bytes).build();
    }
}
