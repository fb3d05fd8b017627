package dev.devanks.mediagen.orchestrator.model;

/**
 * Shape of the media a caller expects back. A fallback result always honours the same shape.
 */
public enum OutputKind {
    IMAGE_BATCH(AssetKind.IMAGE),
    SINGLE_VIDEO(AssetKind.VIDEO);

    private final AssetKind assetKind;

    OutputKind(AssetKind assetKind) {
        this.assetKind = assetKind;
    }

    public AssetKind getAssetKind() {
        return assetKind;
    }
}
