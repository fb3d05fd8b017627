package dev.devanks.mediagen.orchestrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One status reading of a remote task, already translated out of the vendor format.
 * {@code resultUrls} is ordered by output index.
 */
@Value
@Builder
public class PollObservation {

    UpstreamStatus status;
    Integer progress;
    String upstreamCode;
    String upstreamMessage;
    @Singular
    List<String> resultUrls;
}
