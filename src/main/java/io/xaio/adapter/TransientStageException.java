package io.xaio.adapter;

import io.xaio.model.ErrorKind;

/**
 * Worth retrying: network errors, timeouts, rate limits, a collaborator that is briefly down.
 */
public final class TransientStageException extends StageException {
    public TransientStageException(String message) {
        super(message);
    }

    public TransientStageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT;
    }
}
