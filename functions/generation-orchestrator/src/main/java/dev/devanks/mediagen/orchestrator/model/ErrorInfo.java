package dev.devanks.mediagen.orchestrator.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ErrorInfo {

    FailureCategory category;
    String detail;
    Integer assetIndex; // only set for upload failures

    public static ErrorInfo of(FailureCategory category, String detail) {
        return ErrorInfo.builder().category(category).detail(detail).build();
    }
}
