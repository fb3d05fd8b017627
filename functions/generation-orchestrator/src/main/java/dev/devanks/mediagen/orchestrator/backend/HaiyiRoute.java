package dev.devanks.mediagen.orchestrator.backend;

/**
 * Submission endpoints of the Haiyi task API. Used as {@code VendorSubmission.route}.
 */
public enum HaiyiRoute {
    TEXT_TO_IMAGE,
    APPLY,
    TEXT_TO_VIDEO,
    IMAGE_TO_VIDEO,
    MULTI_IMAGE_TO_VIDEO
}
