package dev.devanks.mediagen.orchestrator.exception;

import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import lombok.Getter;

/**
 * A stage failure that ends in a placeholder result. The category decides which diagnostic the caller sees.
 */
@Getter
public class GenerationException extends RuntimeException {

    private final FailureCategory category;

    public GenerationException(FailureCategory category, String message) {
        super(message);
        this.category = category;
    }

    public GenerationException(FailureCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
}
