package io.xaio.cli;

import io.xaio.config.PipelineSettings;
import io.xaio.intake.IntakeService;
import io.xaio.model.Stage;
import io.xaio.model.StageRecord;
import io.xaio.observability.AuditLogger;
import io.xaio.runtime.PipelineRuntime;
import io.xaio.runtime.StageRunOutcome;
import io.xaio.runtime.SweepOutcome;
import io.xaio.storage.InfrastructureException;
import io.xaio.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "xaio",
        mixinStandardHelpOptions = true,
        description = "Staged idempotent pipeline: capture, reduce, meta, claims, merge, publish",
        subcommands = {
                XaioCommand.InitCommand.class,
                XaioCommand.IntakeCommand.class,
                XaioCommand.RunStageCommand.class,
                XaioCommand.RunItemCommand.class,
                XaioCommand.SweepCommand.class,
                XaioCommand.ItemCommand.class,
                XaioCommand.FailedCommand.class,
                XaioCommand.ResetCommand.class,
                XaioCommand.StatusCommand.class,
                XaioCommand.AuditVerifyCommand.class
        }
)
public final class XaioCommand implements Runnable {
    public static final int EXIT_OK = 0;
    public static final int EXIT_INFRASTRUCTURE = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_BUSY = 3;
    public static final int EXIT_NOT_FOUND = 4;

    private static final Logger LOG = LoggerFactory.getLogger(XaioCommand.class);

    @Override
    public void run() {
        System.out.println("Use subcommands: init | intake | run-stage | run-item | sweep | item | failed | reset | status | audit-verify");
    }

    /**
     * Command line with the exit-code mapping for failures that escape a subcommand: storage failures exit 1,
     * bad configuration or arguments exit 2.
     */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new XaioCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof InfrastructureException) {
                LOG.error("infrastructure failure: {}", ex.getMessage(), ex);
                System.out.println(error(ex.getMessage()));
                return EXIT_INFRASTRUCTURE;
            }
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println(ex.getMessage());
                return EXIT_USAGE;
            }
            throw ex;
        });
        return cmd;
    }

    static PipelineRuntime runtime(Path config) {
        PipelineRuntime runtime = PipelineRuntime.fromSettings(PipelineSettings.load(config));
        runtime.init();
        return runtime;
    }

    static String error(String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message == null ? "" : message);
        return Jsons.toJson(out);
    }

    @Command(name = "init", description = "Create directories and the SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        XaioCommand parent;

        @Option(names = {"--config"}, required = true, description = "Pipeline settings JSON")
        Path config;

        @Override
        public Integer call() {
            PipelineRuntime runtime = runtime(config);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("root", runtime.settings().rootDir().toString());
            out.put("db", runtime.settings().config().dbFile().toString());
            System.out.println(Jsons.toJson(out));
            return EXIT_OK;
        }
    }

    @Command(name = "intake", description = "Pull new rows from the intake source once")
    static final class IntakeCommand implements Callable<Integer> {
        @ParentCommand
        XaioCommand parent;

        @Option(names = {"--config"}, required = true, description = "Pipeline settings JSON")
        Path config;

        @Override
        public Integer call() {
            Optional<IntakeService.IntakeReport> report = runtime(config).pullIntake();
            if (report.isEmpty()) {
                System.out.println(error("no intake source configured"));
                return EXIT_USAGE;
            }
            System.out.println(Jsons.toJson(report.get()));
            return EXIT_OK;
        }
    }

    @Command(name = "run-stage", description = "Run one stage over its eligible items")
    static final class RunStageCommand implements Callable<Integer> {
        @ParentCommand
        XaioCommand parent;

        @Option(names = {"--config"}, required = true, description = "Pipeline settings JSON")
        Path config;

        @Option(names = {"--stage"}, required = true, description = "capture|reduce|meta|claims|merge|publish")
        String stage;

        @Option(names = {"--limit"}, defaultValue = "0", description = "Batch size; 0 uses the configured batchSize")
        int limit;

        @Override
        public Integer call() {
            Stage s = Stage.fromString(stage);
            PipelineRuntime runtime = runtime(config);
            int batch = limit > 0 ? limit : runtime.settings().batchSize();
            StageRunOutcome outcome = runtime.runStage(s, batch);
            System.out.println(Jsons.toJson(outcome));
            return EXIT_OK;
        }
    }

    @Command(name = "run-item", description = "Run one item through one stage")
    static final class RunItemCommand implements Callable<Integer> {
        @ParentCommand
        XaioCommand parent;

        @Option(names = {"--config"}, required = true, description = "Pipeline settings JSON")
        Path config;

        @Option(names = {"--stage"}, required = true, description = "capture|reduce|meta|claims|merge|publish")
        String stage;

        @Option(names = {"--item"}, required = true, description = "Item id")
        String itemId;

        @Override
        public Integer call() {
            Stage s = Stage.fromString(stage);
            PipelineRuntime runtime = runtime(config);
            if (runtime.ledger().getItem(itemId).isEmpty()) {
                System.out.println(error("item not found"));
                return EXIT_NOT_FOUND;
            }
            System.out.println(Jsons.toJson(runtime.runItem(s, itemId)));
            return EXIT_OK;
        }
    }

    @Command(name = "sweep", description = "Run one full sweep over all stages under the global lease")
    static final class SweepCommand implements Callable<Integer> {
        @ParentCommand
        XaioCommand parent;

        @Option(names = {"--config"}, required = true, description = "Pipeline settings JSON")
        Path config;

        @Option(names = {"--batch-size"}, defaultValue = "0", description = "Per-stage batch size; 0 uses the configured batchSize")
        int batchSize;

        @Override
        public Integer call() {
            PipelineRuntime runtime = runtime(config);
            int batch = batchSize > 0 ? batchSize : runtime.settings().batchSize();
            SweepOutcome outcome = runtime.sweep(batch);
            System.out.println(Jsons.toJson(outcome));
            return outcome.busy() ? EXIT_BUSY : EXIT_OK;
        }
    }

    @Command(name = "item", description = "Show current stage records and the transition log of an item")
    static final class ItemCommand implements Callable<Integer> {
        @ParentCommand
        XaioCommand parent;

        @Option(names = {"--config"}, required = true, description = "Pipeline settings JSON")
        Path config;

        @Parameters(index = "0", description = "Item id")
        String itemId;

        @Override
        public Integer call() {
            Optional<PipelineRuntime.ItemView> view = runtime(config).item(itemId);
            if (view.isEmpty()) {
                System.out.println(error("item not found"));
                return EXIT_NOT_FOUND;
            }
            System.out.println(Jsons.toJson(view.get()));
            return EXIT_OK;
        }
    }

    @Command(name = "failed", description = "List terminal failures")
    static final class FailedCommand implements Callable<Integer> {
        @ParentCommand
        XaioCommand parent;

        @Option(names = {"--config"}, required = true, description = "Pipeline settings JSON")
        Path config;

        @Option(names = {"--stage"}, description = "Restrict to one stage")
        String stage;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            Stage s = stage == null ? null : Stage.fromString(stage);
            List<StageRecord> rows = runtime(config).failed(s, limit);
            System.out.println(Jsons.toJson(rows));
            return EXIT_OK;
        }
    }

    @Command(name = "reset", description = "Supersede a stage record with a fresh PENDING version (forces recompute)")
    static final class ResetCommand implements Callable<Integer> {
        @ParentCommand
        XaioCommand parent;

        @Option(names = {"--config"}, required = true, description = "Pipeline settings JSON")
        Path config;

        @Option(names = {"--item"}, required = true, description = "Item id")
        String itemId;

        @Option(names = {"--stage"}, required = true, description = "capture|reduce|meta|claims|merge|publish")
        String stage;

        @Option(names = {"--reason"}, defaultValue = "", description = "Free-text reason for the audit trail")
        String reason;

        @Option(names = {"--actor"}, defaultValue = "operator", description = "Who requested the reset")
        String actor;

        @Override
        public Integer call() {
            Stage s = Stage.fromString(stage);
            Optional<StageRecord> fresh = runtime(config).reset(itemId, s, reason, actor);
            if (fresh.isEmpty()) {
                System.out.println(error("no record for item/stage"));
                return EXIT_NOT_FOUND;
            }
            System.out.println(Jsons.toJson(fresh.get()));
            return EXIT_OK;
        }
    }

    @Command(name = "status", description = "Count current stage records by stage and status")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        XaioCommand parent;

        @Option(names = {"--config"}, required = true, description = "Pipeline settings JSON")
        Path config;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(runtime(config).status()));
            return EXIT_OK;
        }
    }

    @Command(name = "audit-verify", description = "Verify the hash chain of the audit log")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        XaioCommand parent;

        @Option(names = {"--config"}, required = true, description = "Pipeline settings JSON")
        Path config;

        @Override
        public Integer call() {
            AuditLogger.VerifyResult result = runtime(config).audit().verify();
            System.out.println(Jsons.toJson(result));
            return result.valid() ? EXIT_OK : EXIT_INFRASTRUCTURE;
        }
    }
}
