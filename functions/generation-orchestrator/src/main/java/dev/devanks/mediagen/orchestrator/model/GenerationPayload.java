package dev.devanks.mediagen.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * JSON body accepted by the {@code generateMedia} function.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerationPayload {

    @JsonProperty("model")
    private String model;

    @JsonProperty("prompt")
    private String prompt;

    @JsonProperty("outputKind")
    private OutputKind outputKind; // defaults to what the model produces

    @JsonProperty("aspectRatio")
    private String aspectRatio;

    @JsonProperty("resolution")
    private String resolution;

    @JsonProperty("durationSeconds")
    private Integer durationSeconds;

    @JsonProperty("audioEffect")
    private Boolean audioEffect;

    @JsonProperty("hdMode")
    private Boolean hdMode;

    @JsonProperty("references")
    private List<Reference> references;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Reference {
        @JsonProperty("name")
        private String name;

        @JsonProperty("base64")
        private String base64; // raw base64 or a data: URI
    }
}
