package dev.devanks.mediagen.orchestrator.exception;

import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import lombok.Getter;

@Getter
public class AssetUploadException extends GenerationException {

    private final int assetIndex;

    public AssetUploadException(int assetIndex, String message) {
        super(FailureCategory.UPLOAD_ERROR, message);
        this.assetIndex = assetIndex;
    }

    public AssetUploadException(int assetIndex, String message, Throwable cause) {
        super(FailureCategory.UPLOAD_ERROR, message, cause);
        this.assetIndex = assetIndex;
    }
}
