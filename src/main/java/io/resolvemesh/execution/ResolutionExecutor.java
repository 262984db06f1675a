package io.resolvemesh.execution;

import com.fasterxml.jackson.databind.JsonNode;
import io.resolvemesh.config.EngineSettings;
import io.resolvemesh.exception.CodeGenerationException;
import io.resolvemesh.exception.SandboxUnavailableException;
import io.resolvemesh.model.Attempt;
import io.resolvemesh.model.DecisionSource;
import io.resolvemesh.model.FailureClass;
import io.resolvemesh.model.ResolutionRequest;
import io.resolvemesh.model.SourceEvidence;
import io.resolvemesh.model.SourceExchange;
import io.resolvemesh.model.Transcript;
import io.resolvemesh.rules.AncillaryRules;
import io.resolvemesh.storage.TranscriptStore;
import io.resolvemesh.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs one resolution attempt: template or generated code, sandbox execution, evidence collection.
 * Expected failures are returned as a failed {@link Attempt}, never thrown.
 */
public final class ResolutionExecutor {
    private static final Logger log = LoggerFactory.getLogger(ResolutionExecutor.class);
    private static final int MAX_ERROR_CHARS = 512;

    private final TemplateRegistry templates;
    private final CodeGenerator generator;
    private final Sandbox sandbox;
    private final TranscriptStore transcripts;
    private final ResolutionPromptBuilder prompts;
    private final ScriptAnalyzer analyzer;
    private final Supplier<EngineSettings> settings;
    private final Clock clock;

    public ResolutionExecutor(
            TemplateRegistry templates,
            CodeGenerator generator,
            Sandbox sandbox,
            TranscriptStore transcripts,
            Supplier<EngineSettings> settings,
            Clock clock
    ) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.generator = generator;
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox");
        this.transcripts = Objects.requireNonNull(transcripts, "transcripts");
        this.prompts = new ResolutionPromptBuilder();
        this.analyzer = new ScriptAnalyzer();
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Attempt execute(ResolutionRequest request, int attemptNumber, long attemptEpoch) {
        long startedAt = clock.millis();
        EngineSettings current = settings.get();
        AncillaryRules rules = AncillaryRules.parse(request.ancillaryData());
        List<String> hosts = rules.allowedHosts(current.allowedHosts());
        Run run = new Run();

        try {
            Optional<String> template = templates.find(rules.templateId());
            if (template.isPresent()) {
                run.codeSource = DecisionSource.TEMPLATE;
                run.templateId = rules.templateId();
                run.code = template.get();
            } else if (generator == null) {
                run.fail("no template '" + rules.templateId() + "' and no code generator configured",
                        FailureClass.TRANSIENT_INFRASTRUCTURE);
            } else {
                run.codeSource = DecisionSource.GENERATED;
                ResolutionPromptBuilder.PreparedPrompt prepared = prompts.build(rules, hosts, regenerationContext(request, attemptNumber));
                run.prompt = prepared.prompt();
                GeneratedCode generated = generator.generate(prepared.prompt());
                run.code = prompts.restore(generated.code(), prepared.placeholders());
                ScriptAnalyzer.Analysis analysis = analyzer.analyze(run.code);
                run.warnings = analysis.warnings();
                if (!analysis.accepted()) {
                    run.fail("generated code rejected: " + String.join("; ", analysis.issues()), FailureClass.SEMANTIC_REJECTION);
                } else if (!analysis.warnings().isEmpty()) {
                    log.info("Generated code for {} has confidence {}: {}", request.requestId(), analysis.confidence(), analysis.warnings());
                }
            }
            if (run.failure == null) {
                runSandbox(request, attemptEpoch, hosts, current, run);
            }
        } catch (CodeGenerationException e) {
            run.fail("code generation failed: " + e.getMessage(), FailureClass.TRANSIENT_INFRASTRUCTURE);
        } catch (SandboxUnavailableException e) {
            run.fail("sandbox unavailable: " + e.getMessage(), FailureClass.TRANSIENT_INFRASTRUCTURE);
        }

        long finishedAt = clock.millis();
        Attempt attempt = new Attempt(
                request.requestId(),
                attemptNumber,
                attemptEpoch,
                startedAt,
                finishedAt,
                run.codeSource,
                run.templateId,
                run.code,
                run.stdout(),
                run.stderr(),
                run.failure == null ? run.output : null,
                run.failure == null ? run.evidence : List.of(),
                run.failure,
                run.failureClass
        );
        try {
            transcripts.write(new Transcript(
                    request.requestId(),
                    attemptNumber,
                    attemptEpoch,
                    startedAt,
                    finishedAt,
                    run.codeSource,
                    run.templateId,
                    run.prompt,
                    run.code,
                    run.warnings,
                    run.result == null || run.result.timedOut() ? null : run.result.exitCode(),
                    run.result != null && run.result.timedOut(),
                    run.stdout(),
                    run.stderr(),
                    run.result == null ? null : run.result.returnValue(),
                    run.result == null ? List.of() : run.result.exchanges(),
                    run.failure,
                    run.failureClass
            ));
        } catch (RuntimeException e) {
            log.error("Failed to persist transcript for {} epoch {}", request.requestId(), attemptEpoch, e);
            return failed(attempt, "transcript persistence failed: " + e.getMessage());
        }
        return attempt;
    }

    private void runSandbox(ResolutionRequest request, long attemptEpoch, List<String> hosts, EngineSettings current, Run run) {
        SandboxResult result = sandbox.execute(new SandboxJob(
                request.requestId(),
                attemptEpoch,
                run.code,
                Duration.ofMillis(current.executorTimeoutMs()),
                hosts
        ));
        run.result = result;
        if (result.timedOut()) {
            run.fail("execution timed out after " + Duration.ofMillis(current.executorTimeoutMs()), FailureClass.TRANSIENT_INFRASTRUCTURE);
            return;
        }
        if (result.exitCode() != 0) {
            run.fail("script exit=" + result.exitCode() + " stderr=" + truncate(result.stderr()), FailureClass.SEMANTIC_REJECTION);
            return;
        }
        Optional<JsonNode> output = OutputExtractor.extract(result);
        if (output.isEmpty()) {
            run.fail("no JSON result in script output", FailureClass.SEMANTIC_REJECTION);
            return;
        }
        run.output = output.get();
        run.evidence = collectEvidence(result.exchanges(), output.get(), clock.millis());
    }

    private ResolutionPromptBuilder.RegenerationContext regenerationContext(ResolutionRequest request, int attemptNumber) {
        if (attemptNumber <= 1) {
            return null;
        }
        return transcripts.latest(request.requestId())
                .filter(t -> t.code() != null && t.codeSource() == DecisionSource.GENERATED)
                .map(t -> new ResolutionPromptBuilder.RegenerationContext(
                        t.code(),
                        t.failure() != null ? t.failure() : request.lastError()))
                .orElse(null);
    }

    /**
     * Hashes every recorded exchange; sources the script names without a matching exchange or an
     * explicit hash are kept with an empty hash so verification can reject them.
     */
    static List<SourceEvidence> collectEvidence(List<SourceExchange> exchanges, JsonNode output, long nowMs) {
        Map<String, SourceEvidence> byUrl = new LinkedHashMap<>();
        for (SourceExchange exchange : exchanges) {
            String body = exchange.responseBody() == null ? "" : exchange.responseBody();
            long fetchedAt = exchange.fetchedAtMs() > 0L ? exchange.fetchedAtMs() : nowMs;
            byUrl.putIfAbsent(exchange.url(), new SourceEvidence(exchange.url(), Hashing.sha256Hex(body), fetchedAt));
        }
        JsonNode sources = output.path("sources");
        if (sources.isArray()) {
            for (JsonNode source : sources) {
                if (source.isTextual()) {
                    byUrl.putIfAbsent(source.asText(), new SourceEvidence(source.asText(), "", 0L));
                } else if (source.isObject() && !source.path("url").asText("").isBlank()) {
                    String url = source.path("url").asText();
                    byUrl.putIfAbsent(url, new SourceEvidence(url, source.path("sha256").asText(""), nowMs));
                }
            }
        }
        return new ArrayList<>(byUrl.values());
    }

    private static Attempt failed(Attempt attempt, String failure) {
        return new Attempt(attempt.requestId(), attempt.attemptNumber(), attempt.attemptEpoch(), attempt.startedAtMs(),
                attempt.finishedAtMs(), attempt.codeSource(), attempt.templateId(), attempt.code(), attempt.stdout(),
                attempt.stderr(), null, List.of(), failure, FailureClass.TRANSIENT_INFRASTRUCTURE);
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }

    private static final class Run {
        DecisionSource codeSource;
        String templateId;
        String prompt;
        String code;
        List<String> warnings = List.of();
        SandboxResult result;
        JsonNode output;
        List<SourceEvidence> evidence = List.of();
        String failure;
        FailureClass failureClass;

        void fail(String message, FailureClass failureClass) {
            this.failure = message;
            this.failureClass = failureClass;
        }

        String stdout() {
            return result == null ? "" : result.stdout();
        }

        String stderr() {
            return result == null ? "" : result.stderr();
        }
    }
}
