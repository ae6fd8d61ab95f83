package io.xaio.runtime;

import io.xaio.intake.IntakeService;

import java.util.List;

public record SweepOutcome(
        boolean busy,
        String holder,
        boolean leaseLost,
        IntakeService.IntakeReport intake,
        List<StageRunOutcome> stages,
        int published,
        int failed,
        int reportsDelivered,
        int reportsPending,
        long durationMs
) {
    public SweepOutcome {
        stages = List.copyOf(stages);
    }

    public static SweepOutcome busy(String holder) {
        return new SweepOutcome(true, holder, false, null, List.of(), 0, 0, 0, 0, 0L);
    }
}
