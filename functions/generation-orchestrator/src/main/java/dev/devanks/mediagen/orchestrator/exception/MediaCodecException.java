package dev.devanks.mediagen.orchestrator.exception;

/**
 * Bytes that cannot be decoded or encoded as the expected media.
 */
public class MediaCodecException extends RuntimeException {

    public MediaCodecException(String message) {
        super(message);
    }

    public MediaCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
