package io.resolvemesh.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.resolvemesh.security.SensitiveDataMasker;
import io.resolvemesh.util.Hashing;
import io.resolvemesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row and an HMAC
 * signature of its own hash.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    static final ObjectMapper COMPACT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private final Path auditFile;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException e) {
                    log.debug("Audit log {} created concurrently", auditFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("request_id", event.requestId());
        row.put("attempt_epoch", event.attemptEpoch());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    /**
     * Re-walks the hash chain over the last {@code limit} rows (all rows when {@code limit <= 0}).
     */
    public synchronized IntegrityReport verifyIntegrity(int limit) {
        if (!Files.exists(auditFile)) {
            return new IntegrityReport(true, 0, 0, 0, "", "");
        }
        int totalRows = 0;
        int checkedRows = 0;
        int brokenLine = 0;
        String reason = "";
        String expectedPrev = "";
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            int start = limit > 0 && limit < lines.size() ? lines.size() - limit : 0;
            for (int i = start; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line == null || line.isBlank()) {
                    continue;
                }
                totalRows++;
                JsonNode parsed;
                try {
                    parsed = Jsons.mapper().readTree(line);
                } catch (JsonProcessingException e) {
                    brokenLine = i + 1;
                    reason = "invalid_json";
                    break;
                }
                String hash = parsed.path("hash").asText("");
                String prevHash = parsed.path("prev_hash").asText("");
                if (hash.isBlank()) {
                    brokenLine = i + 1;
                    reason = "missing_hash";
                    break;
                }
                if (i > start && !prevHash.equals(expectedPrev)) {
                    brokenLine = i + 1;
                    reason = "prev_hash_mismatch";
                    break;
                }
                ObjectNode canonical = (ObjectNode) parsed.deepCopy();
                canonical.remove("hash");
                canonical.remove("signature");
                if (!Hashing.sha256Hex(toCompactJson(canonical)).equals(hash)) {
                    brokenLine = i + 1;
                    reason = "hash_mismatch";
                    break;
                }
                String signature = parsed.path("signature").asText("");
                if (!signingSecret.isBlank() && !Hashing.hmacSha256Hex(signingSecret, hash).equals(signature)) {
                    brokenLine = i + 1;
                    reason = "signature_mismatch";
                    break;
                }
                checkedRows++;
                expectedPrev = hash;
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit integrity", e);
        }
        return new IntegrityReport(brokenLine == 0, totalRows, checkedRows, brokenLine, reason, expectedPrev);
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path file() {
        return auditFile;
    }

    private String loadLastHash() {
        if (!Files.exists(auditFile)) {
            return "";
        }
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            log.warn("Audit log tail unreadable, starting a new chain segment: {}", e.getMessage());
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    static String toCompactJson(Object row) {
        try {
            return COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }

    public record IntegrityReport(boolean ok, int totalRows, int checkedRows, int brokenLine, String reason, String lastHash) {
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String requestId,
            Long attemptEpoch,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String requestId,
                Long attemptEpoch,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, requestId, attemptEpoch, details == null ? Map.of() : details);
        }
    }
}
