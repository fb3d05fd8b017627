package dev.devanks.mediagen.orchestrator.model;

public enum SubmissionVariant {
    TEXT_ONLY,
    SINGLE_IMAGE,
    MULTI_IMAGE
}
