package ai.attackframework.tools.logwindow;

import ai.attackframework.tools.logwindow.log.BoundedLogBuffer;
import ai.attackframework.tools.logwindow.log.Level;
import ai.attackframework.tools.logwindow.log.LogRecordFormatter;
import ai.attackframework.tools.logwindow.log.WindowDestination;
import ai.attackframework.tools.logwindow.utils.config.LogWindowConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class LogWindowAppTest {

    @Test
    void no_path_means_defaults() {
        assertThat(LogWindowApp.loadConfig(null)).isEqualTo(LogWindowConfig.defaults());
    }

    @Test
    void missing_or_malformed_file_falls_back_to_defaults(@TempDir Path dir) throws Exception {
        assertThat(LogWindowApp.loadConfig(dir.resolve("absent.json"))).isEqualTo(LogWindowConfig.defaults());

        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{not json", StandardCharsets.UTF_8);
        assertThat(LogWindowApp.loadConfig(broken)).isEqualTo(LogWindowConfig.defaults());

        Path array = dir.resolve("array.json");
        Files.writeString(array, "[1,2]", StandardCharsets.UTF_8);
        assertThat(LogWindowApp.loadConfig(array)).isEqualTo(LogWindowConfig.defaults());
    }

    @Test
    void valid_file_is_loaded(@TempDir Path dir) throws Exception {
        Path cfg = dir.resolve("window.json");
        Files.writeString(cfg, "{\"maxItems\":5,\"minLevel\":\"ERROR\",\"title\":\"Server\"}", StandardCharsets.UTF_8);

        LogWindowConfig c = LogWindowApp.loadConfig(cfg);

        assertThat(c.maxItems()).isEqualTo(5);
        assertThat(c.minLevel()).isEqualTo(Level.ERROR);
        assertThat(c.title()).isEqualTo("Server");
    }

    @Test
    void destination_uses_config_capacity_and_pattern() {
        WindowDestination dest = LogWindowApp.createDestination(
                new LogWindowConfig(3, Level.INFO, true, "HH:mm", null));

        assertThat(dest.buffer().capacity()).isEqualTo(3);
        assertThat(dest.formatter().pattern()).isEqualTo("HH:mm");
    }

    @Test
    void invalid_pattern_and_unbounded_capacity() {
        WindowDestination dest = LogWindowApp.createDestination(
                new LogWindowConfig(0, Level.INFO, true, "yyyy-MM-dd {{bogus", null));

        assertThat(dest.buffer().capacity()).isEqualTo(BoundedLogBuffer.UNBOUNDED);
        assertThat(dest.formatter().pattern()).isEqualTo(LogRecordFormatter.DEFAULT_PATTERN);
    }
}
