package dev.devanks.mediagen.orchestrator.model;

import java.util.Locale;

/**
 * Generation service a model is hosted on. Each vendor has its own backend and request builder.
 */
public enum Vendor {
    HAIYI,
    DASHSCOPE;

    /**
     * Parses the lower-case name used in payloads, {@code null} or blank meaning {@link #HAIYI}.
     */
    public static Vendor fromName(String name) {
        if (name == null || name.isBlank()) {
            return HAIYI;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown vendor '" + name + "', expected haiyi or dashscope", e);
        }
    }
}
