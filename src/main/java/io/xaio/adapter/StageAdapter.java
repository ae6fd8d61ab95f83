package io.xaio.adapter;

import io.xaio.model.Stage;

/**
 * Stage-specific transformation. Implementations have no access to the ledger or leases and must be safe to
 * call again with the same input. Anything thrown other than a {@link StageException} is treated as transient.
 */
public interface StageAdapter {
    Stage stage();

    StageResult transform(StageInput input) throws Exception;
}
