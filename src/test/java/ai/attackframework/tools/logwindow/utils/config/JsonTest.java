package ai.attackframework.tools.logwindow.utils.config;

import ai.attackframework.tools.logwindow.log.BoundedLogBuffer;
import ai.attackframework.tools.logwindow.log.Level;
import ai.attackframework.tools.logwindow.log.LogRecordFormatter;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class JsonTest {

    @Test
    void parse_reads_all_keys() throws IOException {
        LogWindowConfig c = Json.parse(
                "{\"maxItems\":50,\"minLevel\":\"warn\",\"autoScroll\":false,"
                        + "\"timestampPattern\":\"HH:mm\",\"title\":\"App log\"}");

        assertEquals(50, c.maxItems());
        assertEquals(50, c.bufferCapacity());
        assertEquals(Level.WARN, c.minLevel());
        assertFalse(c.autoScroll());
        assertEquals("HH:mm", c.timestampPattern());
        assertEquals("App log", c.title());
    }

    @Test
    void missing_or_mistyped_keys_take_defaults() throws IOException {
        LogWindowConfig c = Json.parse("{\"maxItems\":\"many\",\"minLevel\":7,\"autoScroll\":\"no\",\"title\":\" \"}");

        assertEquals(LogWindowConfig.defaults(), c);
        assertEquals(LogWindowConfig.defaults(), Json.parse(""));
    }

    @Test
    void non_positive_maxItems_means_unbounded() throws IOException {
        assertEquals(BoundedLogBuffer.UNBOUNDED, Json.parse("{\"maxItems\":0}").bufferCapacity());
        assertEquals(BoundedLogBuffer.UNBOUNDED, Json.parse("{\"maxItems\":-1}").bufferCapacity());
    }

    @Test
    void unknown_level_falls_back_to_info() throws IOException {
        assertEquals(Level.INFO, Json.parse("{\"minLevel\":\"loud\"}").minLevel());
    }

    @Test
    void build_then_parse_keeps_values() throws IOException {
        LogWindowConfig original = new LogWindowConfig(10, Level.ERROR, false, "HH:mm:ss", "Errors");
        String json = Json.build(original);

        assertThat(json).startsWith("{\"maxItems\":10,\"minLevel\":\"ERROR\"");
        assertEquals(original, Json.parse(json));
    }

    @Test
    void defaults_match_formatter_and_buffer_defaults() {
        LogWindowConfig d = LogWindowConfig.defaults();
        assertEquals(1024, d.maxItems());
        assertEquals(Level.INFO, d.minLevel());
        assertTrue(d.autoScroll());
        assertEquals(LogRecordFormatter.DEFAULT_PATTERN, d.timestampPattern());
        assertEquals("Log", d.title());
    }

    @Test
    void malformed_json_and_non_object_root_are_errors() {
        assertThrows(IOException.class, () -> Json.parse("{not json"));
        assertThrows(Json.ConfigJsonException.class, () -> Json.parse("[1,2]"));
    }
}
