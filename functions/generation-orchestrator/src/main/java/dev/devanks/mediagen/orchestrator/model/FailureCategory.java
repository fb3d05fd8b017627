package dev.devanks.mediagen.orchestrator.model;

/**
 * Why an invocation ended without a usable result. Each category has its own diagnostic message;
 * the English text is used when the message bundle cannot be read.
 * Arguments: {0} detail, {1} task id, {2} asset index.
 */
public enum FailureCategory {
    UPLOAD_ERROR("fallback.upload-error",
            "Upload failed: reference image {2} could not be uploaded. {0}"),
    CONTENT_POLICY_REJECTION("fallback.content-policy",
            "Rejected by the content policy of the generation service. Adjust the prompt or reference images and try again. {0}"),
    SUBMISSION_ERROR("fallback.submission-error",
            "Submission failed: {0}"),
    UPSTREAM_FAILURE("fallback.upstream-failure",
            "Generation failed on the service side (task {1}). {0}"),
    UPSTREAM_CANCELLATION("fallback.upstream-cancelled",
            "The service cancelled task {1}, possibly because the input contains sensitive content. Adjust it and try again."),
    POLL_TIMEOUT("fallback.timeout",
            "Task {1} did not finish in time. It may still complete, check it later with the task status query. {0}"),
    RESULT_ASSEMBLY_ERROR("fallback.assembly-error",
            "Generation succeeded but the results could not be downloaded (task {1}). Check the network or the result links. {0}");

    private final String messageKey;
    private final String defaultMessage;

    FailureCategory(String messageKey, String defaultMessage) {
        this.messageKey = messageKey;
        this.defaultMessage = defaultMessage;
    }

    public String getMessageKey() {
        return messageKey;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
