package io.resolvemesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks credentials before audit details hit disk. Chain identifiers (request ids, tx hashes,
 * evidence hashes, addresses) stay readable; source URLs keep their host and path but lose
 * credential query parameters.
 */
public final class SensitiveDataMasker {
    static final String MASK = "***";
    private static final List<String> SENSITIVE_KEY_HINTS = List.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "private_key",
            "privatekey", "mnemonic", "seed_phrase", "credential", "signing_key"
    );
    private static final Pattern CHAIN_HEX = Pattern.compile("^(0x)?[0-9a-fA-F]{40,}$");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{24,}$");
    private static final Pattern BEARER = Pattern.compile("(?i)^(bearer|basic)\\s+\\S+$");
    private static final Pattern URL_CREDENTIAL_PARAM = Pattern.compile(
            "(?i)([?&](?:api_?key|key|token|access_token|secret|sig|signature)=)[^&#\\s]*");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull() || input.isMissingNode()) {
            return JsonNodeFactory.instance.nullNode();
        }
        switch (input.getNodeType()) {
            case OBJECT: {
                ObjectNode out = JsonNodeFactory.instance.objectNode();
                input.fields().forEachRemaining(entry -> out.set(entry.getKey(), isSensitiveKey(entry.getKey())
                        ? JsonNodeFactory.instance.textNode(MASK)
                        : masked(entry.getValue())));
                return out;
            }
            case ARRAY: {
                ArrayNode out = JsonNodeFactory.instance.arrayNode();
                input.forEach(value -> out.add(masked(value)));
                return out;
            }
            case STRING:
                return JsonNodeFactory.instance.textNode(maskValue(input.textValue()));
            default:
                return input;
        }
    }

    /**
     * Key names are matched by substring, case-insensitively. {@code tx_hash} or {@code request_id}
     * never match.
     */
    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (String hint : SENSITIVE_KEY_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return key.equals("key") || key.endsWith("_key");
    }

    static String maskValue(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        if (CHAIN_HEX.matcher(v).matches()) {
            return value;
        }
        Matcher bearer = BEARER.matcher(v);
        if (bearer.matches()) {
            return bearer.group(1) + " " + MASK;
        }
        if (v.contains("://")) {
            return URL_CREDENTIAL_PARAM.matcher(value).replaceAll("$1" + Matcher.quoteReplacement(MASK));
        }
        return likelySecretValue(v) ? MASK : value;
    }

    static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < 24 || CHAIN_HEX.matcher(v).matches()) {
            return false;
        }
        return OPAQUE_TOKEN.matcher(v).matches();
    }
}
