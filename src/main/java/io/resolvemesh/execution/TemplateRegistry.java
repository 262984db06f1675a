package io.resolvemesh.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Pre-vetted resolution scripts keyed by request type. A template bypasses code generation.
 */
public final class TemplateRegistry {
    private static final Logger log = LoggerFactory.getLogger(TemplateRegistry.class);

    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public static TemplateRegistry loadFrom(Path dir) {
        TemplateRegistry registry = new TemplateRegistry();
        if (dir == null || !Files.isDirectory(dir)) {
            return registry;
        }
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(".py")).sorted().toList()) {
                String name = file.getFileName().toString();
                registry.register(name.substring(0, name.length() - 3), Files.readString(file, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to load templates from " + dir, e);
        }
        log.info("Loaded {} resolution templates from {}", registry.templates.size(), dir);
        return registry;
    }

    public void register(String templateId, String code) {
        if (templateId == null || templateId.isBlank()) {
            throw new IllegalArgumentException("template id cannot be empty");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("template code cannot be empty: " + templateId);
        }
        templates.put(normalize(templateId), code);
    }

    public Optional<String> find(String templateId) {
        if (templateId == null || templateId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(normalize(templateId)));
    }

    public Set<String> ids() {
        return new TreeSet<>(templates.keySet());
    }

    private static String normalize(String templateId) {
        return templateId.trim().toLowerCase(Locale.ROOT);
    }
}
