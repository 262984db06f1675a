package io.resolvemesh.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {
    private static final String TX = "0x" + "ab".repeat(32);

    @Test
    void chainVerifiesAndSurvivesReopen() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, "audit-secret");
            writeRows(audit, 3);

            AuditLogger.IntegrityReport report = audit.verifyIntegrity(0);
            Assertions.assertTrue(report.ok(), report.reason());
            Assertions.assertEquals(3, report.totalRows());
            Assertions.assertEquals(3, report.checkedRows());
            Assertions.assertEquals(audit.currentHash(), report.lastHash());

            AuditLogger reopened = new AuditLogger(file, "audit-secret");
            Assertions.assertEquals(audit.currentHash(), reopened.currentHash());
            writeRows(reopened, 1);
            Assertions.assertTrue(reopened.verifyIntegrity(0).ok());
            Assertions.assertEquals(4, reopened.verifyIntegrity(0).checkedRows());
            Assertions.assertEquals(2, reopened.verifyIntegrity(2).totalRows());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void credentialsAreMaskedButChainIdentifiersKept() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-audit-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, "");
            audit.log(AuditLogger.AuditEvent.of("settlement.submit", "engine", "settlement", "ok", "0xreq", 2L, Map.of(
                    "api_key", "sk-live-123",
                    "tx_hash", TX,
                    "headers", Map.of("Authorization", "Bearer abc"),
                    "note", "confirmed in block 101"
            )));
            String line = Files.readString(file, StandardCharsets.UTF_8);
            Assertions.assertTrue(line.contains("\"api_key\":\"***\""));
            Assertions.assertTrue(line.contains("\"Authorization\":\"***\""));
            Assertions.assertTrue(line.contains(TX));
            Assertions.assertTrue(line.contains("confirmed in block 101"));
            Assertions.assertFalse(line.contains("sk-live-123"));
            Assertions.assertFalse(line.contains("\"signature\""));
            Assertions.assertTrue(audit.verifyIntegrity(0).ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tamperingIsDetected() throws Exception {
        Path root = Files.createTempDirectory("resolvemesh-test-audit-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file, "audit-secret");
            writeRows(audit, 3);
            List<String> original = Files.readAllLines(file, StandardCharsets.UTF_8);

            List<String> edited = new ArrayList<>(original);
            edited.set(1, edited.get(1).replace("\"result\":\"applied\"", "\"result\":\"rejected\""));
            Files.write(file, edited, StandardCharsets.UTF_8);
            AuditLogger.IntegrityReport edit = audit.verifyIntegrity(0);
            Assertions.assertFalse(edit.ok());
            Assertions.assertEquals("hash_mismatch", edit.reason());
            Assertions.assertEquals(2, edit.brokenLine());

            List<String> dropped = new ArrayList<>(original);
            dropped.remove(1);
            Files.write(file, dropped, StandardCharsets.UTF_8);
            AuditLogger.IntegrityReport gap = audit.verifyIntegrity(0);
            Assertions.assertEquals("prev_hash_mismatch", gap.reason());
            Assertions.assertEquals(2, gap.brokenLine());

            Files.write(file, original, StandardCharsets.UTF_8);
            Assertions.assertEquals("signature_mismatch", new AuditLogger(file, "other-secret").verifyIntegrity(0).reason());

            Files.writeString(file, "{not json\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
            AuditLogger.IntegrityReport broken = audit.verifyIntegrity(0);
            Assertions.assertEquals("invalid_json", broken.reason());
            Assertions.assertEquals(4, broken.brokenLine());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void writeRows(AuditLogger audit, int count) {
        for (int i = 0; i < count; i++) {
            audit.log(AuditLogger.AuditEvent.of("operator.force_retry", "alice", "request", "applied", "0xreq" + i,
                    (long) i, Map.of("reason", "row " + i)));
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
