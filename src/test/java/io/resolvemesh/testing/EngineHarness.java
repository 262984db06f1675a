package io.resolvemesh.testing;

import io.resolvemesh.config.ResolveMeshConfig;
import io.resolvemesh.execution.TemplateRegistry;
import io.resolvemesh.model.RequestView;
import io.resolvemesh.runtime.EngineCollaborators;
import io.resolvemesh.runtime.ResolutionEngine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Fully wired engine over fakes with a hand-driven clock. Settlement runs inline; execution runs on
 * the supplied executor.
 */
public final class EngineHarness implements AutoCloseable {
    public static final long START_MS = 1_700_000_000_000L;
    /** One minute after {@link #START_MS}, in epoch seconds. */
    public static final long REQUEST_TS = START_MS / 1_000L + 60L;
    public static final String TEMPLATE_ID = "eth_close";
    public static final String SOURCE_URL = "https://api.example.com/eth";
    public static final String TEMPLATE_CODE = FakeCodeGenerator.VALID_SCRIPT;
    public static final String ANCILLARY = "q: Did the ETH/USD daily close exceed 3000?, template: " + TEMPLATE_ID
            + ", sources: " + SOURCE_URL;
    private static final String FAST_SETTLEMENT = """
            "settlementTxRetryBackoffMs": 0, "settlementPollIntervalMs": 0, "settlementConfirmTimeoutMs": 50""";

    private final Path root;
    private final MutableClock clock;
    private final FakeTimeSource timeSource;
    private final FakeOracleChain chain;
    private final FakeSandbox sandbox;
    private final FakeCodeGenerator generator;
    private final AtomicBoolean authorized = new AtomicBoolean(true);
    private final ResolutionEngine engine;

    private EngineHarness(Path root, FakeSandbox sandbox, Executor workers) {
        this.root = root;
        this.clock = new MutableClock(START_MS);
        this.timeSource = new FakeTimeSource(clock);
        this.chain = new FakeOracleChain();
        this.sandbox = sandbox;
        this.generator = new FakeCodeGenerator();
        TemplateRegistry templates = new TemplateRegistry();
        templates.register(TEMPLATE_ID, TEMPLATE_CODE);
        EngineCollaborators collaborators = new EngineCollaborators(
                chain,
                signer -> authorized.get(),
                timeSource,
                sandbox,
                generator,
                templates,
                clock,
                workers,
                Runnable::run
        );
        this.engine = new ResolutionEngine(ResolveMeshConfig.fromRoot(root.toString()), collaborators);
    }

    /**
     * @param extraSettings additional settings-file fields, e.g. {@code "maxAttempts": 2}; may be empty
     */
    public static EngineHarness start(String prefix, String extraSettings, FakeSandbox sandbox, Executor workers)
            throws IOException {
        Path root = Files.createTempDirectory("resolvemesh-test-" + prefix + "-");
        String fields = extraSettings == null || extraSettings.isBlank()
                ? FAST_SETTLEMENT
                : FAST_SETTLEMENT + ", " + extraSettings;
        Files.writeString(root.resolve(ResolveMeshConfig.SETTINGS_FILE_NAME), "{" + fields + "}", StandardCharsets.UTF_8);
        EngineHarness harness = new EngineHarness(root, sandbox, workers);
        harness.engine.init();
        return harness;
    }

    public static FakeSandbox acceptingSandbox() {
        return FakeSandbox.printing(
                "{\"decision\": true, \"reason\": \"close 3100\", \"sources\": [\"" + SOURCE_URL + "\"]}",
                FakeSandbox.exchange(SOURCE_URL, "{\"close\": 3100}")
        );
    }

    public RequestView publishDefaultRequest() {
        return chain.publish(new RequestView("YES_OR_NO_QUERY", REQUEST_TS, ANCILLARY, "0xrequester"));
    }

    public long earliestMs() {
        return REQUEST_TS * 1_000L;
    }

    public Path root() {
        return root;
    }

    public MutableClock clock() {
        return clock;
    }

    public FakeTimeSource timeSource() {
        return timeSource;
    }

    public FakeOracleChain chain() {
        return chain;
    }

    public FakeSandbox sandbox() {
        return sandbox;
    }

    public FakeCodeGenerator generator() {
        return generator;
    }

    public void setAuthorized(boolean value) {
        authorized.set(value);
    }

    public ResolutionEngine engine() {
        return engine;
    }

    @Override
    public void close() throws IOException {
        engine.close();
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
