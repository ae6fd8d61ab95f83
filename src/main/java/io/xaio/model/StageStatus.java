package io.xaio.model;

public enum StageStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED;

    /**
     * Legal edges within one record version. FAILED back to RUNNING is the explicit retry path.
     */
    public boolean canTransitionTo(StageStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next == DONE || next == FAILED;
            case FAILED -> next == RUNNING;
            case DONE -> false;
        };
    }
}
