package dev.devanks.mediagen.orchestrator.exception;

import dev.devanks.mediagen.orchestrator.model.FailureCategory;

public class ResultAssemblyException extends GenerationException {

    public ResultAssemblyException(String message) {
        super(FailureCategory.RESULT_ASSEMBLY_ERROR, message);
    }

    public ResultAssemblyException(String message, Throwable cause) {
        super(FailureCategory.RESULT_ASSEMBLY_ERROR, message, cause);
    }
}
