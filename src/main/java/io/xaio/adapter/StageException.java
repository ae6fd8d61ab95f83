package io.xaio.adapter;

import io.xaio.model.ErrorKind;

/**
 * Checked failure raised by the external collaborators a stage adapter calls.
 */
public abstract class StageException extends Exception {
    protected StageException(String message) {
        super(message);
    }

    protected StageException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
