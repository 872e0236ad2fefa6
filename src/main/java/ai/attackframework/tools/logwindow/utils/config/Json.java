package ai.attackframework.tools.logwindow.utils.config;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ai.attackframework.tools.logwindow.log.Level;

/**
 * JSON marshaling for {@link LogWindowConfig}.
 * Produces compact JSON with deterministic field order (stable insertion order).
 *
 * <pre>{"maxItems":1024,"minLevel":"INFO","autoScroll":true,"timestampPattern":"...","title":"Log"}</pre>
 */
public final class Json {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, false); // compact output

    private Json() { }

    /** Dedicated runtime exception for config JSON errors. */
    public static final class ConfigJsonException extends RuntimeException {
        public ConfigJsonException(String message, Throwable cause) { super(message, cause); }
    }

    /* ======================== BUILD ======================== */

    public static String build(LogWindowConfig config) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put(ConfigKeys.MAX_ITEMS, config.maxItems());
        root.put(ConfigKeys.MIN_LEVEL, config.minLevel().name());
        root.put(ConfigKeys.AUTO_SCROLL, config.autoScroll());
        root.put(ConfigKeys.TIMESTAMP_PATTERN, config.timestampPattern());
        root.put(ConfigKeys.TITLE, config.title());

        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ConfigJsonException("JSON serialization error", e);
        }
    }

    /* ======================== PARSE ======================== */

    /**
     * Parses config JSON. Missing or mistyped keys take the defaults of
     * {@link LogWindowConfig#defaults()}; unknown level names become INFO.
     *
     * @param json JSON text
     * @return parsed config
     * @throws IOException when the text is not valid JSON
     * @throws ConfigJsonException when the root is not a JSON object
     */
    public static LogWindowConfig parse(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json == null ? "" : json);
        if (root == null || root.isMissingNode()) {
            return LogWindowConfig.defaults();
        }
        if (!root.isObject()) {
            throw new ConfigJsonException("Config root must be a JSON object", null);
        }

        JsonNode maxNode = root.path(ConfigKeys.MAX_ITEMS);
        int maxItems = maxNode.canConvertToInt() ? maxNode.asInt() : LogWindowConfig.DEFAULT_MAX_ITEMS;

        JsonNode levelNode = root.path(ConfigKeys.MIN_LEVEL);
        Level minLevel = levelNode.isTextual() ? Level.fromString(levelNode.asText()) : LogWindowConfig.DEFAULT_MIN_LEVEL;

        JsonNode scrollNode = root.path(ConfigKeys.AUTO_SCROLL);
        boolean autoScroll = !scrollNode.isBoolean() || scrollNode.asBoolean();

        return new LogWindowConfig(maxItems, minLevel, autoScroll,
                textOrNull(root, ConfigKeys.TIMESTAMP_PATTERN),
                textOrNull(root, ConfigKeys.TITLE));
    }

    private static String textOrNull(JsonNode root, String key) {
        JsonNode n = root.path(key);
        if (!n.isTextual()) return null;
        String v = n.asText();
        return v.isBlank() ? null : v;
    }
}
