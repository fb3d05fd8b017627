package dev.devanks.mediagen.orchestrator.model;

import lombok.Builder;
import lombok.Data;

/**
 * One media item of a task, either a reference handed in by the caller or an output produced upstream.
 * The index defines ordering and is never reassigned.
 */
@Data
@Builder
public class Asset {

    private final int index;
    private final AssetKind kind;
    private final String sourceRef;
    private String remoteUrl;
    private byte[] bytes;
}
