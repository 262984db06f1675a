package io.resolvemesh.config;

import io.resolvemesh.model.Decision;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class EngineSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-settings-missing-");
        try {
            EngineSettings.SettingsFile file = EngineSettings.readFile(root.resolve("absent.json"));
            Assertions.assertNull(file);
            EngineSettings settings = EngineSettings.fromFile(file, EngineSettings.defaults());
            Assertions.assertEquals(EngineSettings.defaults(), settings);
            Assertions.assertEquals(Decision.INVALID, settings.defaultOutcome());
            Assertions.assertEquals(ResolveMeshConfig.DEFAULT_SIGNER, settings.signer());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreClampedAndNormalized() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-settings-clamp-");
        try {
            Path path = root.resolve("settings.json");
            Files.writeString(path, """
                    {
                      "clockSyncIntervalMs": 10,
                      "clockStaleAfterMs": 500,
                      "maxAttempts": 0,
                      "baseBackoffMs": 2000,
                      "maxBackoffMs": 100,
                      "workerPoolSize": -3,
                      "settlementConfirmTimeoutMs": 0,
                      "settlementMaxConfirmWaits": 0,
                      "defaultOutcome": "true",
                      "allowedHosts": [" API.Example.com ", "api.example.com", "", "data.example.org"],
                      "signer": "  resolver-2  ",
                      "unknownField": 42
                    }
                    """, StandardCharsets.UTF_8);
            EngineSettings settings = EngineSettings.fromFile(EngineSettings.readFile(path), EngineSettings.defaults());

            Assertions.assertEquals(1_000L, settings.clockSyncIntervalMs());
            Assertions.assertEquals(1_000L, settings.clockStaleAfterMs());
            Assertions.assertEquals(1, settings.maxAttempts());
            Assertions.assertEquals(2_000L, settings.maxBackoffMs());
            Assertions.assertEquals(1, settings.workerPoolSize());
            Assertions.assertEquals(1L, settings.settlementConfirmTimeoutMs());
            Assertions.assertEquals(1, settings.settlementMaxConfirmWaits());
            Assertions.assertEquals(Decision.INVALID, settings.defaultOutcome());
            Assertions.assertEquals(List.of("api.example.com", "data.example.org"), settings.allowedHosts());
            Assertions.assertEquals("resolver-2", settings.signer());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void falseIsAnAcceptedDefaultOutcome() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-settings-false-");
        try {
            Path path = root.resolve("settings.json");
            Files.writeString(path, "{\"defaultOutcome\": \"false\", \"graceSeconds\": 30}", StandardCharsets.UTF_8);
            EngineSettings settings = EngineSettings.fromFile(EngineSettings.readFile(path), EngineSettings.defaults());
            Assertions.assertEquals(Decision.FALSE, settings.defaultOutcome());
            Assertions.assertEquals(30L, settings.graceSeconds());
            Assertions.assertEquals(ResolveMeshConfig.DEFAULT_MAX_ATTEMPTS, settings.maxAttempts());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedFileIsReported() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-settings-bad-");
        try {
            Path path = root.resolve("settings.json");
            Files.writeString(path, "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> EngineSettings.readFile(path));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
