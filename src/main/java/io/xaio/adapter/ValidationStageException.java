package io.xaio.adapter;

import io.xaio.model.ErrorKind;

/**
 * The input or the produced output is unusable; retrying with the same input cannot help.
 */
public final class ValidationStageException extends StageException {
    public ValidationStageException(String message) {
        super(message);
    }

    public ValidationStageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
