package dev.devanks.mediagen.orchestrator.model;

import lombok.NonNull;
import lombok.Value;

import java.awt.image.BufferedImage;

@Value
public class ImageFrame implements MediaPayload {

    @NonNull
    BufferedImage image;

    @Override
    public AssetKind getKind() {
        return AssetKind.IMAGE;
    }

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }
}
