package dev.devanks.mediagen.orchestrator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Local reference image supplied with a request. {@code bytes} holds an encoded image (PNG, JPEG...).
 */
@Value
@Builder
public class SourceAsset {

    @NonNull
    String sourceRef;
    @NonNull
    byte[] bytes;
}
