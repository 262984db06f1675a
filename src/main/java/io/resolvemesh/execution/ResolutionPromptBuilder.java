package io.resolvemesh.execution;

import io.resolvemesh.rules.AncillaryRules;
import io.resolvemesh.rules.OutcomeType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the generation prompt for a request. Output depends only on the ancillary rules, the
 * allow-list and the optional regeneration context. Long hex literals are swapped for placeholder
 * tokens so the model cannot corrupt them; {@link #restore} puts them back into generated code.
 */
public final class ResolutionPromptBuilder {
    private static final Pattern LONG_HEX = Pattern.compile("0x[0-9a-fA-F]{32,}");

    public PreparedPrompt build(AncillaryRules rules, List<String> allowedHosts, RegenerationContext previous) {
        Map<String, String> placeholders = new LinkedHashMap<>();
        String question = sanitize(rules.question(), placeholders);

        List<String> lines = new ArrayList<>();
        if (previous != null) {
            lines.add("The previous script failed. Generate a corrected version.");
            lines.add("Previous script:");
            lines.add(sanitize(previous.previousCode(), placeholders));
            lines.add("Error:");
            lines.add(previous.error() == null || previous.error().isBlank() ? "unknown error" : previous.error().trim());
            lines.add("");
        }
        lines.add("You are writing a Python script that resolves an oracle question.");
        lines.add("Follow these rules carefully:");
        int n = 1;
        if (rules.type() == OutcomeType.NUMERIC) {
            lines.add(n++ + ". Determine the numeric answer. Report it as \"value\" and set \"decision\" to \"true\","
                    + " or set \"decision\" to \"invalid\" when the question cannot be answered.");
            lines.add(n++ + ". The value must lie within [" + plain(rules.min()) + ", " + plain(rules.max()) + "]"
                    + " and satisfy the rounding rule " + rules.rounding().describe() + ".");
        } else {
            lines.add(n++ + ". Determine whether the answer is true or false. Use \"invalid\" only when the question"
                    + " is ambiguous or cannot be answered from the sources.");
            if (rules.threshold() != null) {
                lines.add(n++ + ". Report the observed number as \"value\". The decision is true only when the value is"
                        + " strictly greater than " + plain(rules.threshold()) + ".");
            }
            if (!"none".equals(rules.rounding().describe())) {
                lines.add(n++ + ". Any reported \"value\" must satisfy the rounding rule " + rules.rounding().describe() + ".");
            }
        }
        lines.add(n++ + ". Fetch data only with the 'requests' library and only from these hosts: "
                + (allowedHosts.isEmpty() ? "(none listed; use the sources named in the question)" : String.join(", ", allowedHosts)) + ".");
        lines.add(n++ + ". Append one JSON line per HTTP exchange to the file named by the RESOLVEMESH_EXCHANGE_LOG"
                + " environment variable, with keys method, url, status and response (the raw response body).");
        lines.add(n++ + ". Define resolve_oracle() returning a dict with keys decision, reason, sources (the URLs used)"
                + (rules.type() == OutcomeType.NUMERIC || rules.threshold() != null ? " and value." : "."));
        lines.add(n++ + ". Keep every string literal, especially URLs, on a single line in double quotes.");
        lines.add(n++ + ". Place all imports at the top of the script.");
        lines.add(n++ + ". End the script with:");
        lines.add("   if __name__ == \"__main__\":");
        lines.add("       import json");
        lines.add("       print(json.dumps(resolve_oracle()))");
        lines.add(n++ + ". Output raw Python code only.");
        if (!placeholders.isEmpty()) {
            lines.add(n + ". Use the placeholder tokens below exactly as written; declare them as module-level constants"
                    + " and reference the constants instead of guessing the literal:");
            int i = 1;
            for (Map.Entry<String, String> e : placeholders.entrySet()) {
                String literal = e.getValue();
                lines.add("   PLACEHOLDER_HEX_" + i++ + " = \"" + e.getKey() + "\"  # " + abbreviate(literal)
                        + " (length " + literal.length() + ")");
            }
        }
        lines.add("Oracle question:");
        lines.add(question);
        return new PreparedPrompt(String.join("\n", lines) + "\n", placeholders);
    }

    public String restore(String code, Map<String, String> placeholders) {
        String restored = code == null ? "" : code;
        for (Map.Entry<String, String> e : placeholders.entrySet()) {
            restored = restored.replace(e.getKey(), e.getValue());
        }
        return restored;
    }

    private static String sanitize(String text, Map<String, String> placeholders) {
        if (text == null) {
            return "";
        }
        Matcher m = LONG_HEX.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String literal = m.group();
            String token = null;
            for (Map.Entry<String, String> e : placeholders.entrySet()) {
                if (e.getValue().equals(literal)) {
                    token = e.getKey();
                    break;
                }
            }
            if (token == null) {
                token = "__PLACEHOLDER_HEX_" + (placeholders.size() + 1) + "__";
                placeholders.put(token, literal);
            }
            m.appendReplacement(out, Matcher.quoteReplacement(token));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String abbreviate(String literal) {
        return literal.length() > 20 ? literal.substring(0, 10) + "..." + literal.substring(literal.length() - 6) : literal;
    }

    private static String plain(BigDecimal value) {
        return value == null ? "?" : value.toPlainString();
    }

    public record PreparedPrompt(String prompt, Map<String, String> placeholders) {
        public PreparedPrompt {
            placeholders = Collections.unmodifiableMap(new LinkedHashMap<>(placeholders));
        }
    }

    public record RegenerationContext(String previousCode, String error) {
    }
}
