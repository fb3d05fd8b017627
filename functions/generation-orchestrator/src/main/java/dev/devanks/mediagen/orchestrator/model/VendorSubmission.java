package dev.devanks.mediagen.orchestrator.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A fully built request, ready to be sent. {@code route} selects the backend endpoint and is only
 * meaningful to the backend that the builder targets.
 */
@Value
@Builder
public class VendorSubmission {

    @NonNull
    String route;
    @NonNull
    JsonNode payload;
    String routingKey;
    SubmissionVariant variant;
}
