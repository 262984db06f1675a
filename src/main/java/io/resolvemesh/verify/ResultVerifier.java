package io.resolvemesh.verify;

import com.fasterxml.jackson.databind.JsonNode;
import io.resolvemesh.model.Attempt;
import io.resolvemesh.model.Decision;
import io.resolvemesh.model.Outcome;
import io.resolvemesh.model.SourceEvidence;
import io.resolvemesh.rules.AncillaryRules;
import io.resolvemesh.rules.OutcomeType;
import io.resolvemesh.util.Hashing;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Accepts or rejects a candidate outcome. Checks run in order: schema, rounding and threshold,
 * then source evidence. Nothing rejected here is ever promoted to accepted.
 */
public final class ResultVerifier {

    public Verdict verify(Attempt attempt, AncillaryRules rules) {
        return verify(attempt, rules, List.of());
    }

    /**
     * @param defaultHosts operator-configured hosts allowed in addition to the request's own sources
     */
    public Verdict verify(Attempt attempt, AncillaryRules rules, List<String> defaultHosts) {
        if (attempt == null || !attempt.succeeded()) {
            return Verdict.rejected(attempt == null ? "no attempt" : "attempt failed: " + attempt.failure());
        }
        if (!rules.wellFormed()) {
            return Verdict.rejected("ancillary rules malformed: " + String.join("; ", rules.problems()));
        }
        JsonNode output = attempt.output();
        if (output == null || !output.isObject()) {
            return Verdict.rejected("output is not a JSON object");
        }
        Optional<Decision> decision = Decision.fromJson(output.get("decision"));
        if (decision.isEmpty()) {
            return Verdict.rejected("decision missing or not one of true, false, invalid: " + output.path("decision"));
        }
        BigDecimal value = null;
        JsonNode rawValue = output.get("value");
        if (rawValue != null && !rawValue.isNull()) {
            value = decimal(rawValue);
            if (value == null) {
                return Verdict.rejected("value is not a number: " + rawValue);
            }
        }
        Verdict checked = checkOutcome(decision.get(), value, rules);
        if (!checked.accepted()) {
            return checked;
        }
        String sourceProblem = checkSources(attempt.sourceEvidence(), rules.allowedHosts(defaultHosts));
        if (sourceProblem != null) {
            return Verdict.rejected(sourceProblem);
        }
        return checked;
    }

    /**
     * Operator-supplied outcomes pass the same schema and rounding checks; they carry no fetched sources.
     */
    public Verdict verifyOperator(Outcome outcome, AncillaryRules rules) {
        if (outcome == null) {
            return Verdict.rejected("no operator outcome");
        }
        if (!rules.wellFormed()) {
            return Verdict.rejected("ancillary rules malformed: " + String.join("; ", rules.problems()));
        }
        return checkOutcome(outcome.decision(), outcome.value(), rules);
    }

    private Verdict checkOutcome(Decision decision, BigDecimal value, AncillaryRules rules) {
        if (rules.type() == OutcomeType.NUMERIC) {
            if (decision == Decision.INVALID) {
                return Verdict.accepted(Outcome.binary(Decision.INVALID));
            }
            if (decision != Decision.TRUE) {
                return Verdict.rejected("numeric request must report decision true with a value, or invalid");
            }
            if (value == null) {
                return Verdict.rejected("numeric request reported no value");
            }
            if (value.compareTo(rules.min()) < 0 || value.compareTo(rules.max()) > 0) {
                return Verdict.rejected("value " + value.toPlainString() + " outside ["
                        + rules.min().toPlainString() + ", " + rules.max().toPlainString() + "]");
            }
            if (!rules.rounding().conforms(value)) {
                return Verdict.rejected("value " + value.toPlainString() + " violates rounding " + rules.rounding().describe());
            }
            return Verdict.accepted(Outcome.numeric(value));
        }

        if (decision == Decision.INVALID) {
            return Verdict.accepted(Outcome.binary(Decision.INVALID));
        }
        if (value != null && !rules.rounding().conforms(value)) {
            return Verdict.rejected("value " + value.toPlainString() + " violates rounding " + rules.rounding().describe());
        }
        if (rules.threshold() != null) {
            if (value == null) {
                return Verdict.rejected("threshold question reported no value");
            }
            boolean above = value.compareTo(rules.threshold()) > 0;
            if (above != (decision == Decision.TRUE)) {
                return Verdict.rejected("decision " + decision.wireValue() + " inconsistent with value "
                        + value.toPlainString() + " and threshold " + rules.threshold().toPlainString());
            }
        }
        return Verdict.accepted(Outcome.binary(decision));
    }

    private String checkSources(List<SourceEvidence> evidence, List<String> allowed) {
        if (evidence == null || evidence.isEmpty()) {
            return "no source evidence";
        }
        for (SourceEvidence source : evidence) {
            if (source.source() == null || source.source().isBlank()) {
                return "source evidence without a source";
            }
            if (!Hashing.isSha256Hex(source.sha256())) {
                return "source " + source.source() + " has no content hash";
            }
            if (!allowed.isEmpty()) {
                String host = AncillaryRules.hostOf(source.source());
                if (host == null || !allowed.contains(host)) {
                    return "source " + source.source() + " is not an allowed host";
                }
            }
        }
        return null;
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node.isNumber()) {
            // 1e400 parses as a double holding Infinity.
            if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) {
                return null;
            }
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public record Verdict(boolean accepted, String reason, Outcome outcome) {
        public static Verdict accepted(Outcome outcome) {
            return new Verdict(true, null, outcome);
        }

        public static Verdict rejected(String reason) {
            return new Verdict(false, reason, null);
        }
    }
}
