package io.clgrader.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.clgrader.core.util.ArgumentTokenizer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Typed field access on a `JsonNode` tree with path-qualified error messages.
///
/// Every failure is a {@link JsonMappingException} whose message starts with the JSON path
/// of the offending value, for example `sections[0].unit_tests.tests[1]: ...`.
///
/// @implNote Package-private. Used by {@link AssessmentDeserializer}.
final class JsonFields {

    private JsonFields() {}

    static JsonMappingException error(String path, String message) {
        return JsonMappingException.from((JsonParser) null, path + ": " + message);
    }

    static JsonMappingException error(String path, String message, Throwable cause) {
        return JsonMappingException.from((JsonParser) null, path + ": " + message, cause);
    }

    /// Fails on keys outside `allowed`.
    static void checkKeys(JsonNode node, String path, Set<String> allowed)
            throws JsonMappingException {
        requireObject(node, path);
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                throw error(path, "unknown field '" + name + "'");
            }
        }
    }

    static void requireObject(JsonNode node, String path) throws JsonMappingException {
        if (node == null || !node.isObject()) {
            throw error(path, "expected an object");
        }
    }

    static boolean has(JsonNode node, String field) {
        return node.has(field) && !node.get(field).isNull();
    }

    static String text(JsonNode node, String path, String field) throws JsonMappingException {
        String value = optText(node, path, field);
        if (value == null) {
            throw error(path, "missing required field '" + field + "'");
        }
        return value;
    }

    static String optText(JsonNode node, String path, String field) throws JsonMappingException {
        if (!has(node, field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (!value.isTextual()) {
            throw error(path + "." + field, "expected a string");
        }
        return value.asText();
    }

    static Integer optInt(JsonNode node, String path, String field) throws JsonMappingException {
        if (!has(node, field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw error(path + "." + field, "expected an integer");
        }
        return value.intValue();
    }

    static Long optLong(JsonNode node, String path, String field) throws JsonMappingException {
        if (!has(node, field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw error(path + "." + field, "expected an integer");
        }
        return value.longValue();
    }

    static Integer optWeight(JsonNode node, String path) throws JsonMappingException {
        Integer weight = optInt(node, path, "weight");
        if (weight != null && weight < 0) {
            throw error(path + ".weight", "must not be negative");
        }
        return weight;
    }

    static Double optDouble(JsonNode node, String path, String field) throws JsonMappingException {
        if (!has(node, field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (!value.isNumber()) {
            throw error(path + "." + field, "expected a number");
        }
        return value.doubleValue();
    }

    static Boolean optBoolean(JsonNode node, String path, String field)
            throws JsonMappingException {
        if (!has(node, field)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (!value.isBoolean()) {
            throw error(path + "." + field, "expected a boolean");
        }
        return value.booleanValue();
    }

    /// Reads a millisecond duration, which must be positive.
    static Duration optMillis(JsonNode node, String path, String field)
            throws JsonMappingException {
        Long millis = optLong(node, path, field);
        if (millis == null) {
            return null;
        }
        if (millis <= 0) {
            throw error(path + "." + field, "must be positive");
        }
        return Duration.ofMillis(millis);
    }

    static JsonNode array(JsonNode node, String path, String field) throws JsonMappingException {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw error(path + "." + field, "expected an array");
        }
        return value;
    }

    static List<String> stringList(JsonNode node, String path, String field)
            throws JsonMappingException {
        if (!has(node, field)) {
            return List.of();
        }
        return strings(array(node, path, field), path + "." + field);
    }

    static List<String> strings(JsonNode array, String path) throws JsonMappingException {
        List<String> values = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonNode element = array.get(i);
            if (!element.isTextual()) {
                throw error(path + "[" + i + "]", "expected a string");
            }
            values.add(element.asText());
        }
        return values;
    }

    /// Reads an argument vector given either as one shell-style string or as an array.
    static List<String> arguments(JsonNode value, String path) throws JsonMappingException {
        if (value.isTextual()) {
            try {
                return ArgumentTokenizer.split(value.asText());
            } catch (IllegalArgumentException e) {
                throw error(path, "invalid argument string: " + e.getMessage(), e);
            }
        }
        if (value.isArray()) {
            return strings(value, path);
        }
        throw error(path, "expected a string or an array of strings");
    }

    static List<String> optArguments(JsonNode node, String path, String field)
            throws JsonMappingException {
        return has(node, field) ? arguments(node.get(field), path + "." + field) : List.of();
    }

    /// Reads a string map given either as an object or as an array of `[key, value]` pairs.
    static Map<String, String> pairs(JsonNode node, String path, String field)
            throws JsonMappingException {
        Map<String, String> values = new LinkedHashMap<>();
        if (!has(node, field)) {
            return values;
        }
        JsonNode value = node.get(field);
        String fieldPath = path + "." + field;
        if (value.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> entries = value.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                if (!entry.getValue().isTextual()) {
                    throw error(fieldPath + "." + entry.getKey(), "expected a string");
                }
                values.put(entry.getKey(), entry.getValue().asText());
            }
            return values;
        }
        if (!value.isArray()) {
            throw error(fieldPath, "expected an object or an array of pairs");
        }
        for (int i = 0; i < value.size(); i++) {
            JsonNode pair = value.get(i);
            if (!pair.isArray()
                    || pair.size() != 2
                    || !pair.get(0).isTextual()
                    || !pair.get(1).isTextual()) {
                throw error(fieldPath + "[" + i + "]", "expected a [key, value] pair of strings");
            }
            values.put(pair.get(0).asText(), pair.get(1).asText());
        }
        return values;
    }
}
