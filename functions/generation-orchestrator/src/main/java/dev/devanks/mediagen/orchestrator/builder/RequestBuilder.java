package dev.devanks.mediagen.orchestrator.builder;

import dev.devanks.mediagen.orchestrator.config.ModelProfile;
import dev.devanks.mediagen.orchestrator.model.GenerationRequest;
import dev.devanks.mediagen.orchestrator.model.SubmissionVariant;
import dev.devanks.mediagen.orchestrator.model.Vendor;
import dev.devanks.mediagen.orchestrator.model.VendorSubmission;

import java.util.List;

/**
 * Turns a vendor-neutral request into the payload of one vendor endpoint.
 */
public interface RequestBuilder {

    Vendor vendor();

    /**
     * Checks that the model carries everything a submission needs. Called before any upload.
     *
     * @throws dev.devanks.mediagen.orchestrator.exception.ConfigurationException when it does not
     */
    void validate(ModelProfile model);

    /**
     * Decides which submission shape the request takes for this model. The orchestrator uploads
     * references only for non text-only variants.
     *
     * @throws IllegalArgumentException when the request cannot be expressed for this model at all
     */
    SubmissionVariant variantFor(GenerationRequest request, ModelProfile model);

    /**
     * @param referenceUrls uploaded reference URLs in input order, empty for text-only requests
     */
    VendorSubmission build(GenerationRequest request, ModelProfile model, List<String> referenceUrls);
}
