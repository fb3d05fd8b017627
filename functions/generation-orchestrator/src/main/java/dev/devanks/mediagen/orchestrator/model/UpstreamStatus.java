package dev.devanks.mediagen.orchestrator.model;

/**
 * Vendor-neutral status taxonomy. Every vendor code is mapped onto one of these at the client boundary.
 */
public enum UpstreamStatus {
    SUCCESS,
    RUNNING,
    GENERIC_FAILURE,
    UPSTREAM_CANCELLED,
    CONTENT_POLICY_REJECTED
}
