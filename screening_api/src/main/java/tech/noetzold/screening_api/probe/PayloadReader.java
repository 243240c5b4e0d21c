package tech.noetzold.screening_api.probe;

import com.fasterxml.jackson.databind.JsonNode;
import tech.noetzold.screening_api.exception.ProviderException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read helpers over provider JSON. Containers the probe depends on must be present, anything
 * below them is read leniently.
 */
public final class PayloadReader {

    public static final String PROVIDER_SOURCE = "provider_source";

    private PayloadReader() {
    }

    /** Fails with a schema mismatch when the object at {@code field} is absent. */
    public static JsonNode requireObject(String providerId, JsonNode node, String field) {
        JsonNode child = node == null ? null : node.get(field);
        if (child == null || !child.isObject()) {
            throw new ProviderException(providerId, null, "Expected object '" + field + "' in provider payload");
        }
        return child;
    }

    public static JsonNode requireArray(String providerId, JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new ProviderException(providerId, null, "Expected array in provider payload");
        }
        return node;
    }

    public static List<JsonNode> elements(JsonNode node, String... path) {
        JsonNode current = node;
        for (String field : path) {
            if (current == null) {
                break;
            }
            current = current.get(field);
        }
        List<JsonNode> out = new ArrayList<>();
        if (current != null && current.isArray()) {
            current.forEach(out::add);
        }
        return out;
    }

    public static JsonNode first(JsonNode node, String... path) {
        List<JsonNode> items = elements(node, path);
        return items.isEmpty() ? null : items.get(0);
    }

    public static String text(JsonNode node, String... path) {
        JsonNode current = node;
        for (String field : path) {
            if (current == null) {
                return null;
            }
            current = current.get(field);
        }
        if (current == null || current.isNull() || current.isMissingNode()) {
            return null;
        }
        return current.asText();
    }

    public static boolean isBlankText(JsonNode node, String field) {
        String value = text(node, field);
        return value == null || value.isBlank() || "None".equals(value.trim());
    }

    public static boolean flag(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value != null && (value.asBoolean(false) || "true".equalsIgnoreCase(value.asText()));
    }

    public static long number(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null ? 0L : value.asLong(0L);
    }

    /** Selected fields of {@code node} under new names, in the given order: {@code rowKey, jsonField, ...}. */
    public static Map<String, Object> row(JsonNode node, String... renames) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i + 1 < renames.length; i += 2) {
            row.put(renames[i], value(node == null ? null : node.get(renames[i + 1])));
        }
        return row;
    }

    /**
     * Every field of {@code node}, keeping provider field names except {@value CompositeProbe#SOURCE},
     * which aggregates reserve for their own tag and is kept under {@value #PROVIDER_SOURCE}.
     */
    public static Map<String, Object> fullRow(JsonNode node) {
        Map<String, Object> row = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            row.put(providerKey(field.getKey()), value(field.getValue()));
        }
        return row;
    }

    /** Copy of {@code row} with a provider {@value CompositeProbe#SOURCE} key moved to {@value #PROVIDER_SOURCE}. */
    public static Map<String, Object> providerRow(Map<String, Object> row) {
        if (!row.containsKey(CompositeProbe.SOURCE)) {
            return row;
        }
        Map<String, Object> renamed = new LinkedHashMap<>();
        row.forEach((key, value) -> renamed.put(providerKey(key), value));
        return renamed;
    }

    private static String providerKey(String key) {
        return CompositeProbe.SOURCE.equals(key) ? PROVIDER_SOURCE : key;
    }

    public static Object value(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        return node.deepCopy();
    }
}
