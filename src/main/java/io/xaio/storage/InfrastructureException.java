package io.xaio.storage;

/**
 * Storage-level failure (ledger, lease table, artifact files). Item-level errors never use this type; when it
 * escapes a stage run the whole sweep is aborted.
 */
public class InfrastructureException extends RuntimeException {
    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }

    public InfrastructureException(String message) {
        super(message);
    }
}
