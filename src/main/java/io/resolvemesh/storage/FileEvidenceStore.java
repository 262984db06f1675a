package io.resolvemesh.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.resolvemesh.model.EvidenceBundle;
import io.resolvemesh.util.Hashing;
import io.resolvemesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public final class FileEvidenceStore implements EvidenceStore {
    private static final Pattern REVISION_FILE = Pattern.compile("^rev-(\\d{4,})\\.json$");

    private final Path root;

    public FileEvidenceStore(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    /**
     * Hash over the canonical JSON of the bundle, excluding the hash itself and the settlement stamp.
     */
    public static String computeHash(EvidenceBundle bundle) {
        EvidenceBundle content = bundle.withEvidenceHash(null).withSettlementTxHash(null);
        return Hashing.sha256Hex(Jsons.toCanonicalJson(content));
    }

    @Override
    public synchronized EvidenceBundle put(String requestId, EvidenceBundle bundle) {
        if (!requestId.equals(bundle.requestId())) {
            throw new IllegalArgumentException("bundle requestId mismatch: " + bundle.requestId() + " != " + requestId);
        }
        Path dir = requestDir(requestId);
        int revision = revisions(requestId).stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
        EvidenceBundle numbered = bundle.withRevision(revision).withSettlementTxHash(null);
        EvidenceBundle stored = numbered.withEvidenceHash(computeHash(numbered));
        try {
            Files.createDirectories(dir);
            Files.writeString(revisionFile(requestId, revision), Jsons.toJson(stored), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            throw new IllegalStateException("Evidence revision already written: " + requestId + " rev " + revision, e);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write evidence bundle: " + requestId, e);
        }
        return stored;
    }

    @Override
    public Optional<EvidenceBundle> find(String requestId) {
        List<Integer> revisions = revisions(requestId);
        if (revisions.isEmpty()) {
            return Optional.empty();
        }
        return findRevision(requestId, revisions.get(revisions.size() - 1));
    }

    @Override
    public Optional<EvidenceBundle> findRevision(String requestId, int revision) {
        Path file = revisionFile(requestId, revision);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            EvidenceBundle bundle = Jsons.mapper().readValue(Files.readString(file, StandardCharsets.UTF_8), EvidenceBundle.class);
            String txHash = readStamp(requestId, revision);
            return Optional.of(txHash == null ? bundle : bundle.withSettlementTxHash(txHash));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read evidence bundle: " + file, e);
        }
    }

    @Override
    public List<Integer> revisions(String requestId) {
        Path dir = requestDir(requestId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Integer> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.toList()) {
                Matcher m = REVISION_FILE.matcher(file.getFileName().toString());
                if (m.matches()) {
                    out.add(Integer.parseInt(m.group(1)));
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list evidence revisions: " + dir, e);
        }
        out.sort(Comparator.naturalOrder());
        return out;
    }

    @Override
    public synchronized EvidenceBundle stampSettlement(String requestId, int revision, String txHash) {
        if (txHash == null || txHash.isBlank()) {
            throw new IllegalArgumentException("txHash cannot be empty");
        }
        if (findRevision(requestId, revision).isEmpty()) {
            throw new IllegalStateException("No evidence revision " + revision + " for " + requestId);
        }
        String existing = readStamp(requestId, revision);
        if (existing != null) {
            if (!existing.equals(txHash)) {
                throw new IllegalStateException("Evidence " + requestId + " rev " + revision
                        + " already stamped with " + existing);
            }
            return findRevision(requestId, revision).orElseThrow();
        }
        Map<String, Object> stamp = new LinkedHashMap<>();
        stamp.put("requestId", requestId);
        stamp.put("revision", revision);
        stamp.put("txHash", txHash);
        try {
            Files.writeString(stampFile(requestId, revision), Jsons.toJson(stamp), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to stamp settlement on evidence: " + requestId, e);
        }
        return findRevision(requestId, revision).orElseThrow();
    }

    private String readStamp(String requestId, int revision) {
        Path file = stampFile(requestId, revision);
        if (!Files.exists(file)) {
            return null;
        }
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
            String txHash = node.path("txHash").asText("");
            return txHash.isBlank() ? null : txHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settlement stamp: " + file, e);
        }
    }

    private Path requestDir(String requestId) {
        return root.resolve(safeName(requestId));
    }

    private Path revisionFile(String requestId, int revision) {
        return requestDir(requestId).resolve(String.format("rev-%04d.json", revision));
    }

    private Path stampFile(String requestId, int revision) {
        return requestDir(requestId).resolve(String.format("settlement-%04d.json", revision));
    }

    static String safeName(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId cannot be empty");
        }
        StringBuilder sb = new StringBuilder(requestId.length());
        for (int i = 0; i < requestId.length(); i++) {
            char ch = requestId.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-';
            sb.append(ok ? ch : '_');
        }
        return sb.toString();
    }
}
