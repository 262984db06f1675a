package io.resolvemesh.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Static checks on generated code before it is executed. Issues reject the code; warnings only
 * lower the confidence label.
 */
public final class ScriptAnalyzer {
    private static final Pattern ENTRY_POINT = Pattern.compile("(?m)^\\s*def\\s+resolve_oracle\\s*\\(");
    private static final Pattern RETURN = Pattern.compile("(?m)^\\s+return\\b");
    private static final Pattern MAIN_GUARD = Pattern.compile("if\\s+__name__\\s*==\\s*['\"]__main__['\"]");
    private static final Pattern IMPORT = Pattern.compile("(?m)^\\s*(import|from)\\s+\\w");

    public Analysis analyze(String code) {
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (code == null || code.isBlank()) {
            issues.add("empty script");
            return new Analysis(issues, warnings, Confidence.LOW);
        }
        if (!ENTRY_POINT.matcher(code).find()) {
            issues.add("missing resolve_oracle() definition");
        }
        if (!RETURN.matcher(code).find()) {
            issues.add("resolve_oracle() never returns a value");
        }
        if (code.contains("__PLACEHOLDER_HEX_")) {
            issues.add("unrestored placeholder token");
        }
        if (!MAIN_GUARD.matcher(code).find()) {
            warnings.add("missing __main__ guard");
        }
        if (!IMPORT.matcher(code).find()) {
            warnings.add("no imports");
        }
        Confidence confidence;
        if (!issues.isEmpty() || warnings.size() >= 2) {
            confidence = Confidence.LOW;
        } else if (warnings.size() == 1) {
            confidence = Confidence.MEDIUM;
        } else {
            confidence = Confidence.HIGH;
        }
        return new Analysis(issues, warnings, confidence);
    }

    public enum Confidence { HIGH, MEDIUM, LOW }

    public record Analysis(List<String> issues, List<String> warnings, Confidence confidence) {
        public Analysis {
            issues = List.copyOf(issues);
            warnings = List.copyOf(warnings);
        }

        public boolean accepted() {
            return issues.isEmpty();
        }
    }
}
