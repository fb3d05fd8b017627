package dev.devanks.mediagen.orchestrator.model;

/**
 * Decoded media handed to the calling pipeline: an {@link ImageFrame} or a {@link VideoClip}.
 */
public interface MediaPayload {

    AssetKind getKind();
}
