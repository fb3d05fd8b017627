package dev.devanks.mediagen.orchestrator.exception;

/**
 * Missing or unusable configuration. Checked before any network call, where it is reported as an error;
 * raised once a task is under way it becomes a placeholder like any other failure.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
