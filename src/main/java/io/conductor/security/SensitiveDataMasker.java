package io.conductor.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.conductor.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts credentials from audit details and agent transcripts before they are persisted.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-]{32,}$");
    private static final Pattern INLINE_ASSIGNMENT = Pattern.compile(
            "(?i)\\b([A-Z0-9_]*(?:PASSWORD|SECRET|TOKEN|API_KEY|APIKEY))=(\\S+)"
    );
    private static final Pattern BEARER = Pattern.compile("(?i)(bearer\\s+)[A-Za-z0-9._\\-]{8,}");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            if (likelySecretValue(text)) {
                return Jsons.mapper().getNodeFactory().textNode(MASK);
            }
            String scrubbed = maskText(text);
            return scrubbed.equals(text) ? input : Jsons.mapper().getNodeFactory().textNode(scrubbed);
        }
        return input;
    }

    /**
     * Masks {@code NAME_TOKEN=value} assignments and bearer credentials inside free text.
     */
    public static String maskText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = INLINE_ASSIGNMENT.matcher(text).replaceAll("$1=" + MASK);
        return BEARER.matcher(out).replaceAll("$1" + MASK);
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < 32
                || v.chars().noneMatch(Character::isDigit)
                || v.chars().noneMatch(Character::isUpperCase)
                || v.chars().noneMatch(Character::isLowerCase)) {
            return false;
        }
        return OPAQUE_TOKEN.matcher(v).matches();
    }
}
