package dev.devanks.mediagen.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * JSON view of a {@link GenerationResult} returned by the function endpoint.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL) // taskId/failureCategory are absent on some paths
public class GenerationReport {

    public enum Status {
        SUCCESS, FALLBACK, ERROR
    }

    private Status status;
    private boolean usedFallback;
    private String infoText;
    private OutputKind outputKind;
    private int assetCount;
    private Integer width;
    private Integer height;
    private String taskId;
    private FailureCategory failureCategory;
    private List<String> remoteUrls;
}
