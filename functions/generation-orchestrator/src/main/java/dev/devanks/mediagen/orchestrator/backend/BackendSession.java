package dev.devanks.mediagen.orchestrator.backend;

import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.model.PollObservation;
import dev.devanks.mediagen.orchestrator.model.SubmissionOutcome;
import dev.devanks.mediagen.orchestrator.model.Vendor;
import dev.devanks.mediagen.orchestrator.model.VendorSubmission;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * A backend bound to the settings snapshot of one invocation. Handed from stage to stage so that a
 * reload in between never reaches a task already under way.
 */
@Value
public class BackendSession {

    @NonNull
    GenerationBackend backend;
    @NonNull
    OrchestratorSettings settings;

    public Vendor vendor() {
        return backend.vendor();
    }

    public String uploadAsset(byte[] bytes, String fileName, String contentType, String scope) {
        return backend.uploadAsset(bytes, fileName, contentType, scope, settings);
    }

    public SubmissionOutcome submit(VendorSubmission submission) {
        return backend.submit(submission, settings);
    }

    public Optional<PollObservation> poll(String taskId, String routingKey) {
        return backend.poll(taskId, routingKey, settings);
    }

    public boolean reportsBalance() {
        return backend.reportsBalance();
    }

    public int queryBalance() {
        return backend.queryBalance(settings);
    }

    public byte[] download(String url) {
        return backend.download(url, settings);
    }
}
