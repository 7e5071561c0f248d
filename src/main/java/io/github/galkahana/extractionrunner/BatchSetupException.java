package io.github.galkahana.extractionrunner;

/**
 * Thrown when a run cannot start: invalid configuration or an output destination that cannot be created.
 * No task has been attempted when this is thrown.
 */
public class BatchSetupException extends RuntimeException {

    public BatchSetupException(String message) {
        super(message);
    }

    public BatchSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
