package dev.devanks.mediagen.orchestrator.model;

public enum AssetKind {
    IMAGE, VIDEO
}
