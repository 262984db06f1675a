package io.resolvemesh.execution;

import com.fasterxml.jackson.databind.JsonNode;
import io.resolvemesh.exception.SandboxUnavailableException;
import io.resolvemesh.model.SourceExchange;
import io.resolvemesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs resolution code through a local interpreter command. The script receives its allow-list
 * and output locations through the environment:
 *
 * <ul>
 *   <li>{@code RESOLVEMESH_ALLOWED_HOSTS}: comma-separated hosts the code may contact</li>
 *   <li>{@code RESOLVEMESH_EXCHANGE_LOG}: JSON-lines file the code appends source exchanges to</li>
 *   <li>{@code RESOLVEMESH_RESULT_FILE}: optional JSON return value</li>
 * </ul>
 *
 * <p>Network isolation is not enforced here; deploy behind an egress proxy that honours the allow-list.
 */
public final class ProcessSandbox implements Sandbox {
    private static final Logger log = LoggerFactory.getLogger(ProcessSandbox.class);
    static final int MAX_CAPTURE_CHARS = 1_048_576;

    private final List<String> command;
    private final Path workRoot;
    private final String scriptName;

    public ProcessSandbox(List<String> command, Path workRoot, String scriptName) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("sandbox command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.workRoot = workRoot;
        this.scriptName = scriptName == null || scriptName.isBlank() ? "resolve.py" : scriptName;
    }

    @Override
    public SandboxResult execute(SandboxJob job) {
        Path workDir;
        try {
            Files.createDirectories(workRoot);
            workDir = Files.createTempDirectory(workRoot, "run-");
        } catch (IOException e) {
            throw new SandboxUnavailableException("sandbox work directory unavailable: " + workRoot, e);
        }
        try {
            return run(job, workDir);
        } finally {
            deleteQuietly(workDir);
        }
    }

    private SandboxResult run(SandboxJob job, Path workDir) {
        Path script = workDir.resolve(scriptName);
        Path stdoutFile = workDir.resolve("stdout.txt");
        Path stderrFile = workDir.resolve("stderr.txt");
        Path exchangeLog = workDir.resolve("exchanges.jsonl");
        Path resultFile = workDir.resolve("result.json");
        try {
            Files.writeString(script, job.code() == null ? "" : job.code(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SandboxUnavailableException("failed to stage script", e);
        }

        List<String> argv = new ArrayList<>(command);
        argv.add(script.toString());
        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.directory(workDir.toFile());
        pb.redirectOutput(stdoutFile.toFile());
        pb.redirectError(stderrFile.toFile());
        Map<String, String> env = pb.environment();
        env.put("RESOLVEMESH_REQUEST_ID", job.requestId());
        env.put("RESOLVEMESH_ALLOWED_HOSTS", String.join(",", job.allowedHosts()));
        env.put("RESOLVEMESH_EXCHANGE_LOG", exchangeLog.toString());
        env.put("RESOLVEMESH_RESULT_FILE", resultFile.toString());

        long started = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new SandboxUnavailableException("sandbox spawn failed: " + e.getMessage(), e);
        }
        try {
            boolean finished = process.waitFor(job.timeout().toMillis(), TimeUnit.MILLISECONDS);
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return SandboxResult.timeout(readCapped(stdoutFile), readCapped(stderrFile), durationMs);
            }
            return new SandboxResult(
                    process.exitValue(),
                    readCapped(stdoutFile),
                    readCapped(stderrFile),
                    readReturnValue(resultFile),
                    readExchanges(exchangeLog),
                    false,
                    durationMs
            );
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new SandboxUnavailableException("interrupted while waiting for sandbox", e);
        }
    }

    private String readCapped(Path file) {
        if (!Files.exists(file)) {
            return "";
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        // Reads one char past the cap to tell a full capture from a truncated one.
        char[] buffer = new char[MAX_CAPTURE_CHARS + 1];
        int filled = 0;
        try (Reader reader = new InputStreamReader(Files.newInputStream(file), decoder)) {
            while (filled < buffer.length) {
                int read = reader.read(buffer, filled, buffer.length - filled);
                if (read < 0) {
                    break;
                }
                filled += read;
            }
            return filled <= MAX_CAPTURE_CHARS
                    ? new String(buffer, 0, filled)
                    : new String(buffer, 0, MAX_CAPTURE_CHARS) + "...";
        } catch (IOException e) {
            throw new SandboxUnavailableException("failed to read sandbox output: " + file.getFileName(), e);
        }
    }

    private JsonNode readReturnValue(Path file) {
        if (!Files.exists(file)) {
            return null;
        }
        return Jsons.tryParseObject(readCapped(file)).orElse(null);
    }

    private List<SourceExchange> readExchanges(Path file) {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<SourceExchange> out = new ArrayList<>();
        int malformed = 0;
        for (String line : readCapped(file).split("\\r?\\n")) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode node = Jsons.tryParseObject(line).orElse(null);
            if (node == null || node.path("url").asText("").isBlank()) {
                malformed++;
                continue;
            }
            out.add(new SourceExchange(
                    node.path("method").asText("GET"),
                    node.path("url").asText(),
                    node.path("status").asInt(0),
                    node.path("request").isMissingNode() ? null : node.path("request").asText(null),
                    node.path("response").asText(""),
                    node.path("fetched_at_ms").asLong(0L)
            ));
        }
        if (malformed > 0) {
            log.warn("Ignored {} malformed exchange log lines", malformed);
        }
        return out;
    }

    private void deleteQuietly(Path root) {
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Failed to clean sandbox work directory {}: {}", root, e.getMessage());
        }
    }
}
