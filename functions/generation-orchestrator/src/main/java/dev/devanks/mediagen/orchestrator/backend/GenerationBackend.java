package dev.devanks.mediagen.orchestrator.backend;

import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.exception.BackendException;
import dev.devanks.mediagen.orchestrator.model.PollObservation;
import dev.devanks.mediagen.orchestrator.model.SubmissionOutcome;
import dev.devanks.mediagen.orchestrator.model.Vendor;
import dev.devanks.mediagen.orchestrator.model.VendorSubmission;

import java.util.Optional;

/**
 * The remote generation service, reduced to the five calls the orchestrator needs.
 * Implementations translate vendor payloads at this boundary; nothing vendor-shaped leaks out.
 * <p>
 * Every call receives the settings snapshot of the invocation it serves, so credentials and timeouts
 * never change halfway through a task.
 */
public interface GenerationBackend {

    Vendor vendor();

    /**
     * Uploads one encoded reference image.
     *
     * @param scope vendor id the upload is attached to (model or app)
     * @return URL usable in a submission
     * @throws BackendException when any step of the upload fails
     */
    String uploadAsset(byte[] bytes, String fileName, String contentType, String scope, OrchestratorSettings settings);

    /**
     * Sends a built request. Refusals and transport errors come back as a rejected outcome, not an exception.
     */
    SubmissionOutcome submit(VendorSubmission submission, OrchestratorSettings settings);

    /**
     * Single status query.
     *
     * @return empty when the service answered but knows nothing about the task
     * @throws BackendException on transport errors or an unusable response
     */
    Optional<PollObservation> poll(String taskId, String routingKey, OrchestratorSettings settings);

    /**
     * Whether {@link #queryBalance} means anything for this vendor.
     */
    default boolean reportsBalance() {
        return true;
    }

    /**
     * @throws BackendException when the balance cannot be read
     */
    int queryBalance(OrchestratorSettings settings);

    /**
     * @throws BackendException when the download fails or returns no bytes
     */
    byte[] download(String url, OrchestratorSettings settings);
}
