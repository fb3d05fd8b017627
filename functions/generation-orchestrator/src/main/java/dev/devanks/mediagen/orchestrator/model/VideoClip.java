package dev.devanks.mediagen.orchestrator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Encoded video as downloaded. An empty clip is the placeholder used when nothing could be produced.
 */
@Value
public class VideoClip implements MediaPayload {

    @NonNull
    byte[] bytes;
    @NonNull
    String container;
    String sourceUrl;

    public static VideoClip empty(String container) {
        return new VideoClip(new byte[0], container, null);
    }

    @Override
    public AssetKind getKind() {
        return AssetKind.VIDEO;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }
}
