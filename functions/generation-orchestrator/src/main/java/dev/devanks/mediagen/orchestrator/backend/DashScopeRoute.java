package dev.devanks.mediagen.orchestrator.backend;

/**
 * Asynchronous submission endpoints of DashScope. Used as {@code VendorSubmission.route}.
 */
public enum DashScopeRoute {
    /** text-to-video and image-to-video share one endpoint */
    VIDEO_SYNTHESIS,
    /** first and last frame */
    KEYFRAME_VIDEO,
    IMAGE_SYNTHESIS
}
