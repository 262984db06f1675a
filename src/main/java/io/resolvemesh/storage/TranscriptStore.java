package io.resolvemesh.storage;

import io.resolvemesh.model.Transcript;
import io.resolvemesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Write-once per-attempt transcripts under {@code transcripts/<requestId>/}, keyed by attempt epoch.
 */
public final class TranscriptStore {
    private final Path root;

    public TranscriptStore(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path write(Transcript transcript) {
        Path dir = root.resolve(FileEvidenceStore.safeName(transcript.requestId()));
        Path file = dir.resolve(String.format("attempt-e%06d.json", transcript.attemptEpoch()));
        try {
            Files.createDirectories(dir);
            Files.writeString(file, Jsons.toJson(transcript), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return file;
        } catch (FileAlreadyExistsException e) {
            throw new IllegalStateException("Transcript already written: " + file, e);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write transcript: " + file, e);
        }
    }

    public List<Transcript> list(String requestId) {
        Path dir = root.resolve(FileEvidenceStore.safeName(requestId));
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Transcript> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().toList()) {
                out.add(Jsons.mapper().readValue(Files.readString(file, StandardCharsets.UTF_8), Transcript.class));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read transcripts: " + dir, e);
        }
        return out;
    }

    public Optional<Transcript> latest(String requestId) {
        List<Transcript> all = list(requestId);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }
}
