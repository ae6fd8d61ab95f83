package io.xaio.runtime;

import io.xaio.model.Stage;

import java.util.ArrayList;
import java.util.List;

public record StageRunOutcome(
        Stage stage,
        int eligible,
        int processed,
        int done,
        int reused,
        int skippedBusy,
        int skippedIdempotent,
        int retryScheduled,
        int failedTerminal,
        int staleInput,
        int conflicts,
        int reclaimed,
        List<ItemResult> items
) {
    public StageRunOutcome {
        items = List.copyOf(items);
    }

    public enum ItemOutcome {
        DONE,
        REUSED,
        SKIPPED_BUSY,
        SKIPPED_IDEMPOTENT,
        RETRY_SCHEDULED,
        FAILED_TERMINAL,
        STALE_INPUT,
        CONFLICT,
        NOT_READY,
        NOT_DUE,
        BLOCKED_TERMINAL
    }

    public record ItemResult(String itemId, Stage stage, ItemOutcome outcome, String detail) {
    }

    static final class Tally {
        private final Stage stage;
        private final List<ItemResult> items = new ArrayList<>();
        private int eligible;
        private int reclaimed;

        Tally(Stage stage) {
            this.stage = stage;
        }

        void eligible(int n) {
            eligible = n;
        }

        void reclaimed(int n) {
            reclaimed += n;
        }

        void add(ItemResult result) {
            items.add(result);
        }

        StageRunOutcome build() {
            int processed = 0;
            int done = 0;
            int reused = 0;
            int busy = 0;
            int idempotent = 0;
            int retry = 0;
            int terminal = 0;
            int stale = 0;
            int conflicts = 0;
            for (ItemResult r : items) {
                switch (r.outcome()) {
                    case DONE -> done++;
                    case REUSED -> reused++;
                    case SKIPPED_BUSY -> busy++;
                    case SKIPPED_IDEMPOTENT -> idempotent++;
                    case RETRY_SCHEDULED -> retry++;
                    case FAILED_TERMINAL -> terminal++;
                    case STALE_INPUT -> stale++;
                    case CONFLICT -> conflicts++;
                    default -> {
                    }
                }
                switch (r.outcome()) {
                    case DONE, REUSED, RETRY_SCHEDULED, FAILED_TERMINAL, STALE_INPUT -> processed++;
                    default -> {
                    }
                }
            }
            return new StageRunOutcome(stage, eligible, processed, done, reused, busy, idempotent, retry, terminal,
                    stale, conflicts, reclaimed, items);
        }
    }
}
