package io.xaio.runtime;

import io.xaio.adapter.AdapterRegistry;
import io.xaio.adapter.CaptureAdapter;
import io.xaio.adapter.ClaimsAdapter;
import io.xaio.adapter.IntakeSource;
import io.xaio.adapter.MergeAdapter;
import io.xaio.adapter.MetaAdapter;
import io.xaio.adapter.PublishAdapter;
import io.xaio.adapter.ReduceAdapter;
import io.xaio.adapter.script.ScriptAiTransformClient;
import io.xaio.adapter.script.ScriptCaptureClient;
import io.xaio.adapter.script.ScriptInvoker;
import io.xaio.adapter.script.ScriptPublishClient;
import io.xaio.config.PipelineSettings;
import io.xaio.config.XaioConfig;
import io.xaio.intake.IntakeService;
import io.xaio.intake.TsvIntakeSource;
import io.xaio.model.Stage;
import io.xaio.model.StageRecord;
import io.xaio.model.StageTransition;
import io.xaio.model.WorkItem;
import io.xaio.observability.AuditLogger;
import io.xaio.storage.ArtifactStore;
import io.xaio.storage.Database;
import io.xaio.storage.IntakeReportStore;
import io.xaio.storage.LeaseManager;
import io.xaio.storage.StateLedger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wires storage, adapters and runners for one pipeline root. The CLI builds one per invocation.
 */
public final class PipelineRuntime {
    private final PipelineSettings settings;
    private final Clock clock;
    private final Database database;
    private final StateLedger ledger;
    private final LeaseManager leases;
    private final ArtifactStore artifacts;
    private final AuditLogger audit;
    private final AdapterRegistry adapters;
    private final IntakeService intake;
    private final IntakeReportStore reports;

    public PipelineRuntime(PipelineSettings settings, AdapterRegistry adapters, IntakeSource intakeSource, Clock clock) {
        XaioConfig config = settings.config();
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config);
        this.ledger = new StateLedger(database);
        this.leases = new LeaseManager(database);
        this.artifacts = new ArtifactStore(config);
        this.audit = new AuditLogger(config.auditFile(), clock);
        this.adapters = adapters;
        this.intake = intakeSource == null ? null : new IntakeService(intakeSource, ledger, audit, settings.workerId());
        this.reports = new IntakeReportStore(database);
    }

    /**
     * Production wiring: script-backed clients for the stages that have a command configured, pure adapters
     * for reduce and merge, and the TSV intake when one is configured.
     */
    public static PipelineRuntime fromSettings(PipelineSettings settings) {
        AdapterRegistry registry = new AdapterRegistry();
        registry.register(new ReduceAdapter(settings.claimsPromptSet(), settings.metaWhitelist()));
        registry.register(new MergeAdapter());
        Map<Stage, List<String>> commands = settings.commands();
        if (commands.containsKey(Stage.CAPTURE)) {
            registry.register(new CaptureAdapter(new ScriptCaptureClient(invoker(settings, Stage.CAPTURE))));
        }
        if (commands.containsKey(Stage.META)) {
            registry.register(new MetaAdapter(new ScriptAiTransformClient(invoker(settings, Stage.META)),
                    settings.metaPromptSet()));
        }
        if (commands.containsKey(Stage.CLAIMS)) {
            registry.register(new ClaimsAdapter(new ScriptAiTransformClient(invoker(settings, Stage.CLAIMS)),
                    settings.claimsPromptSet()));
        }
        if (commands.containsKey(Stage.PUBLISH)) {
            registry.register(new PublishAdapter(new ScriptPublishClient(invoker(settings, Stage.PUBLISH))));
        }
        IntakeSource intakeSource = null;
        if (settings.intake() != null) {
            PipelineSettings.IntakeSettings in = settings.intake();
            intakeSource = new TsvIntakeSource(in.file(), in.firstDataRow(), in.columns());
        }
        return new PipelineRuntime(settings, registry, intakeSource, Clock.systemUTC());
    }

    private static ScriptInvoker invoker(PipelineSettings settings, Stage stage) {
        return new ScriptInvoker(settings.commands().get(stage), settings.scriptTimeoutMs());
    }

    public void init() {
        database.init();
    }

    public PipelineSettings settings() {
        return settings;
    }

    public StateLedger ledger() {
        return ledger;
    }

    public LeaseManager leases() {
        return leases;
    }

    public ArtifactStore artifacts() {
        return artifacts;
    }

    public IntakeReportStore reports() {
        return reports;
    }

    public AuditLogger audit() {
        return audit;
    }

    public Optional<IntakeService.IntakeReport> pullIntake() {
        if (intake == null) {
            return Optional.empty();
        }
        return Optional.of(intake.pull(clock.millis()));
    }

    public StageRunner runner(Stage stage) {
        return new StageRunner(adapters.require(stage), ledger, leases, artifacts, audit, settings, clock);
    }

    public StageRunOutcome runStage(Stage stage, int limit) {
        return runner(stage).run(limit);
    }

    public StageRunOutcome runItem(Stage stage, String itemId) {
        return runner(stage).runItem(itemId);
    }

    public PipelineScheduler scheduler() {
        List<StageRunner> runners = new ArrayList<>();
        for (Stage stage : Stage.values()) {
            runners.add(runner(stage));
        }
        return new PipelineScheduler(runners, ledger, leases, intake, reports, audit, settings, clock);
    }

    public SweepOutcome sweep(int batchSize) {
        return scheduler().sweep(batchSize);
    }

    public Optional<ItemView> item(String itemId) {
        Optional<WorkItem> item = ledger.getItem(itemId);
        if (item.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ItemView(item.get(), ledger.currentRecords(itemId), ledger.transitions(itemId)));
    }

    public List<StageRecord> failed(Stage stage, int limit) {
        return ledger.listFailed(stage, settings.maxAttempts(), limit);
    }

    public List<StateLedger.StatusCount> status() {
        return ledger.countByStatus();
    }

    public Optional<StageRecord> reset(String itemId, Stage stage, String reason, String actor) {
        Optional<StageRecord> fresh = ledger.reset(itemId, stage, reason, clock.millis());
        fresh.ifPresent(r -> audit.log(AuditLogger.AuditEvent.of("stage.reset", actor, itemId, stage.wireName(), "ok",
                Map.of("version", r.version(), "reason", reason == null ? "" : reason))));
        return fresh;
    }

    public record ItemView(WorkItem item, List<StageRecord> records, List<StageTransition> transitions) {
    }
}
