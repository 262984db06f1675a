package io.resolvemesh.cli;

import io.resolvemesh.config.ResolveMeshConfig;
import io.resolvemesh.exception.EvidenceNotFoundException;
import io.resolvemesh.model.Decision;
import io.resolvemesh.model.EvidenceBundle;
import io.resolvemesh.model.Outcome;
import io.resolvemesh.observability.AuditLogger;
import io.resolvemesh.runtime.ResolutionEngine;
import io.resolvemesh.storage.LifecycleStore;
import io.resolvemesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "resolvemesh",
        mixinStandardHelpOptions = true,
        description = "ResolveMesh operator CLI",
        subcommands = {
                ResolveMeshCommand.InitCommand.class,
                ResolveMeshCommand.StatusCommand.class,
                ResolveMeshCommand.RequestsCommand.class,
                ResolveMeshCommand.EvidenceCommand.class,
                ResolveMeshCommand.TranscriptsCommand.class,
                ResolveMeshCommand.ForceRetryCommand.class,
                ResolveMeshCommand.OverrideCommand.class,
                ResolveMeshCommand.StatsCommand.class,
                ResolveMeshCommand.MetricsCommand.class,
                ResolveMeshCommand.AuditVerifyCommand.class,
                ResolveMeshCommand.SettingsCommand.class
        }
)
public final class ResolveMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = ResolveMeshConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | status | requests | evidence | transcripts | force-retry | override | stats | metrics | audit-verify | settings");
    }

    ResolutionEngine engine() {
        ResolutionEngine engine = ResolutionEngine.detached(ResolveMeshConfig.fromRoot(root));
        engine.init();
        return engine;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ResolveMeshCommand parent;

        @Override
        public Integer call() {
            try (ResolutionEngine engine = parent.engine()) {
                System.out.println("Initialized ResolveMesh at: " + engine.config().rootDir());
                return 0;
            }
        }
    }

    @Command(name = "status", description = "Show lifecycle, settlements and transition history for a request")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        ResolveMeshCommand parent;

        @Parameters(index = "0", description = "Request id")
        String requestId;

        @Override
        public Integer call() {
            try (ResolutionEngine engine = parent.engine()) {
                Optional<ResolutionEngine.RequestStatus> status = engine.status(requestId);
                if (status.isEmpty()) {
                    System.out.println("{\"error\":\"request not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(status.get()));
                return 0;
            }
        }
    }

    @Command(name = "requests", description = "List requests, most recently updated first")
    static final class RequestsCommand implements Callable<Integer> {
        @ParentCommand
        ResolveMeshCommand parent;

        @Option(names = {"--state"}, description = "Filter by lifecycle state: scheduled|resolving|waiting_retry|finalized")
        String state;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            try (ResolutionEngine engine = parent.engine()) {
                System.out.println(Jsons.toJson(engine.requests(state, limit)));
                return 0;
            }
        }
    }

    @Command(name = "evidence", description = "Show the evidence bundle for a request")
    static final class EvidenceCommand implements Callable<Integer> {
        @ParentCommand
        ResolveMeshCommand parent;

        @Parameters(index = "0", description = "Request id")
        String requestId;

        @Option(names = {"--revision"}, defaultValue = "0", description = "Bundle revision; 0 shows the latest")
        int revision;

        @Override
        public Integer call() {
            try (ResolutionEngine engine = parent.engine()) {
                if (revision > 0) {
                    Optional<EvidenceBundle> bundle = engine.evidenceRevision(requestId, revision);
                    if (bundle.isEmpty()) {
                        System.out.println("{\"error\":\"evidence revision not found\"}");
                        return 1;
                    }
                    System.out.println(Jsons.toJson(bundle.get()));
                    return 0;
                }
                try {
                    System.out.println(Jsons.toJson(engine.evidence(requestId)));
                    return 0;
                } catch (EvidenceNotFoundException e) {
                    System.out.println("{\"error\":\"evidence not found\"}");
                    return 1;
                }
            }
        }
    }

    @Command(name = "transcripts", description = "List raw execution transcripts for a request")
    static final class TranscriptsCommand implements Callable<Integer> {
        @ParentCommand
        ResolveMeshCommand parent;

        @Parameters(index = "0", description = "Request id")
        String requestId;

        @Override
        public Integer call() {
            try (ResolutionEngine engine = parent.engine()) {
                System.out.println(Jsons.toJson(engine.transcripts(requestId)));
                return 0;
            }
        }
    }

    @Command(name = "force-retry", description = "Reschedule a waiting request now, or abandon its in-flight attempt")
    static final class ForceRetryCommand implements Callable<Integer> {
        @ParentCommand
        ResolveMeshCommand parent;

        @Parameters(index = "0", description = "Request id")
        String requestId;

        @Option(names = {"--reason"}, description = "Operator reason")
        String reason;

        @Option(names = {"--actor"}, defaultValue = "cli", description = "Operator identity recorded in the audit log")
        String actor;

        @Override
        public Integer call() {
            try (ResolutionEngine engine = parent.engine()) {
                LifecycleStore.TransitionResult out = engine.forceRetry(requestId, reason, actor);
                System.out.println(Jsons.toJson(out));
                return out.applied() ? 0 : 1;
            }
        }
    }

    @Command(name = "override", description = "Supply an operator outcome used on the next dispatch")
    static final class OverrideCommand implements Callable<Integer> {
        @ParentCommand
        ResolveMeshCommand parent;

        @Parameters(index = "0", description = "Request id")
        String requestId;

        @Option(names = {"--decision"}, description = "true|false|invalid")
        String decision;

        @Option(names = {"--value"}, description = "Numeric outcome value")
        BigDecimal value;

        @Option(names = {"--reason"}, description = "Operator reason")
        String reason;

        @Option(names = {"--actor"}, defaultValue = "cli", description = "Operator identity recorded in the audit log")
        String actor;

        @Override
        public Integer call() {
            Outcome outcome = toOutcome();
            if (outcome == null) {
                System.out.println("{\"error\":\"provide --decision true|false|invalid and/or --value\"}");
                return 2;
            }
            try (ResolutionEngine engine = parent.engine()) {
                LifecycleStore.TransitionResult out = engine.supplyOutcome(requestId, outcome, reason, actor);
                System.out.println(Jsons.toJson(out));
                return out.applied() ? 0 : 1;
            }
        }

        private Outcome toOutcome() {
            if (decision == null || decision.isBlank()) {
                return value == null ? null : Outcome.numeric(value);
            }
            Optional<Decision> parsed = Decision.parse(decision);
            return parsed.map(d -> new Outcome(d, value)).orElse(null);
        }
    }

    @Command(name = "stats", description = "Show lifecycle counts and clock anchor status")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        ResolveMeshCommand parent;

        @Override
        public Integer call() {
            try (ResolutionEngine engine = parent.engine()) {
                System.out.println(Jsons.toJson(engine.stats()));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus text metrics")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        ResolveMeshCommand parent;

        @Override
        public Integer call() {
            try (ResolutionEngine engine = parent.engine()) {
                System.out.print(engine.metricsText());
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        ResolveMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "0", description = "Optional tail row limit; 0 verifies full log")
        int limit;

        @Override
        public Integer call() {
            try (ResolutionEngine engine = parent.engine()) {
                AuditLogger.IntegrityReport out = engine.verifyAuditIntegrity(limit);
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "settings", description = "Show effective engine settings, optionally forcing a reload")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        ResolveMeshCommand parent;

        @Option(names = {"--reload"}, description = "Re-read the settings file and report what changed")
        boolean reload;

        @Override
        public Integer call() {
            try (ResolutionEngine engine = parent.engine()) {
                if (reload) {
                    System.out.println(Jsons.toJson(engine.reloadSettings()));
                } else {
                    System.out.println(Jsons.toJson(Map.of(
                            "path", engine.config().settingsFile().toString(),
                            "settings", engine.currentSettings()
                    )));
                }
                return 0;
            }
        }
    }
}
