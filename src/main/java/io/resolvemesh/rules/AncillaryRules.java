package io.resolvemesh.rules;

import java.math.BigDecimal;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolution rules decoded from a request's ancillary data. Ancillary text is a sequence of
 * {@code key: value} pairs separated by newlines or commas. Unknown keys are kept in the question
 * text; malformed values are collected in {@link #problems()} rather than thrown.
 */
public record AncillaryRules(
        String text,
        String question,
        OutcomeType type,
        String templateId,
        BigDecimal min,
        BigDecimal max,
        RoundingRule rounding,
        BigDecimal threshold,
        List<String> sources,
        Long resolveAfterSec,
        Long deadlineSec,
        List<String> problems
) {
    private static final List<String> KEYS = List.of(
            "q", "question", "description", "type", "template", "min", "max", "rounding", "threshold",
            "sources", "resolve_after", "deadline"
    );
    private static final Pattern KEY_PATTERN = Pattern.compile(
            "(?i)(?:^|[\\n,]\\s*)(" + String.join("|", KEYS) + ")\\s*:"
    );
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})+$");
    /** 9999-12-31T23:59:59Z. */
    static final long MAX_EPOCH_SECONDS = 253_402_300_799L;

    public AncillaryRules {
        sources = sources == null ? List.of() : List.copyOf(sources);
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public static AncillaryRules parse(String ancillaryData) {
        String text = decodeText(ancillaryData);
        Map<String, String> values = keyValues(text);
        List<String> problems = new ArrayList<>();

        OutcomeType type = OutcomeType.BINARY;
        try {
            type = OutcomeType.fromString(values.get("type"));
        } catch (IllegalArgumentException e) {
            problems.add(e.getMessage());
        }
        RoundingRule rounding = RoundingRules.none();
        try {
            rounding = RoundingRules.parse(values.get("rounding"));
        } catch (IllegalArgumentException e) {
            problems.add(e.getMessage());
        }
        BigDecimal min = decimal(values, "min", problems);
        BigDecimal max = decimal(values, "max", problems);
        if (min != null && max != null && min.compareTo(max) > 0) {
            problems.add("min greater than max");
        }
        if (type == OutcomeType.NUMERIC && (min == null || max == null)) {
            problems.add("numeric requests must declare min and max");
        }
        String question = values.getOrDefault("q", values.getOrDefault("question", text)).trim();
        String description = values.get("description");
        if (description != null && !description.isBlank() && !question.contains(description.trim())) {
            question = question + "\n" + description.trim();
        }
        String template = values.get("template");
        return new AncillaryRules(
                text,
                question,
                type,
                template == null || template.isBlank() ? null : template.trim(),
                min,
                max,
                rounding,
                decimal(values, "threshold", problems),
                splitSources(values.get("sources")),
                epochSeconds(values, "resolve_after", problems),
                epochSeconds(values, "deadline", problems),
                problems
        );
    }

    public long earliestResolveAtMs(long requestTimestampSec, long graceSeconds) {
        long seconds = resolveAfterSec != null
                ? resolveAfterSec
                : saturatedAdd(requestTimestampSec, Math.max(0L, graceSeconds));
        return secondsToMillis(seconds);
    }

    public long deadlineAtMs(long earliestResolveAtMs, long windowSeconds) {
        if (deadlineSec != null) {
            return Math.max(earliestResolveAtMs, secondsToMillis(deadlineSec));
        }
        return saturatedAdd(earliestResolveAtMs, secondsToMillis(Math.max(1L, windowSeconds)));
    }

    // Saturates so oversized chain or requester values push timing later, never earlier.
    private static long secondsToMillis(long seconds) {
        if (seconds > Long.MAX_VALUE / 1_000L) {
            return Long.MAX_VALUE;
        }
        if (seconds < Long.MIN_VALUE / 1_000L) {
            return Long.MIN_VALUE;
        }
        return seconds * 1_000L;
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        if (((a ^ sum) & (b ^ sum)) < 0) {
            return a < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return sum;
    }

    /**
     * Hosts named by the request's sources, merged with operator-configured defaults.
     */
    public List<String> allowedHosts(List<String> defaults) {
        Set<String> out = new LinkedHashSet<>();
        for (String source : sources) {
            String host = hostOf(source);
            if (host != null) {
                out.add(host);
            }
        }
        if (defaults != null) {
            for (String host : defaults) {
                if (host != null && !host.isBlank()) {
                    out.add(host.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return new ArrayList<>(out);
    }

    public boolean wellFormed() {
        return problems.isEmpty();
    }

    public static String hostOf(String source) {
        if (source == null || source.isBlank()) {
            return null;
        }
        String s = source.trim();
        try {
            URI uri = URI.create(s.contains("://") ? s : "https://" + s);
            return uri.getHost() == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static String decodeText(String ancillaryData) {
        if (ancillaryData == null) {
            return "";
        }
        String raw = ancillaryData.trim();
        if (!HEX.matcher(raw).matches()) {
            return raw;
        }
        byte[] bytes = HexFormat.of().parseHex(raw.substring(2));
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString()
                    .trim();
        } catch (CharacterCodingException e) {
            // Not text: keep the hex form so the prompt still carries the raw bytes.
            return raw;
        }
    }

    private static Map<String, String> keyValues(String text) {
        Map<String, String> out = new LinkedHashMap<>();
        Matcher m = KEY_PATTERN.matcher(text);
        String currentKey = null;
        int valueStart = -1;
        while (m.find()) {
            if (currentKey != null) {
                out.putIfAbsent(currentKey, trimValue(text.substring(valueStart, m.start())));
            }
            currentKey = m.group(1).toLowerCase(Locale.ROOT);
            valueStart = m.end();
        }
        if (currentKey != null) {
            out.putIfAbsent(currentKey, trimValue(text.substring(valueStart)));
        }
        return out;
    }

    private static String trimValue(String raw) {
        String v = raw.trim();
        while (v.endsWith(",")) {
            v = v.substring(0, v.length() - 1).trim();
        }
        return v;
    }

    private static BigDecimal decimal(Map<String, String> values, String key, List<String> problems) {
        String raw = values.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            problems.add(key + " is not a number: " + raw);
            return null;
        }
    }

    private static Long epochSeconds(Map<String, String> values, String key, List<String> problems) {
        String raw = values.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String v = raw.trim();
        long seconds;
        try {
            seconds = Long.parseLong(v);
        } catch (NumberFormatException notEpoch) {
            try {
                seconds = Instant.parse(v).getEpochSecond();
            } catch (DateTimeParseException e) {
                problems.add(key + " is neither epoch seconds nor ISO-8601: " + raw);
                return null;
            }
        }
        if (seconds < 0L || seconds > MAX_EPOCH_SECONDS) {
            problems.add(key + " out of range: " + raw);
            return null;
        }
        return seconds;
    }

    private static List<String> splitSources(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String part : raw.split(";")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }
}
