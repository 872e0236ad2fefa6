package ai.attackframework.tools.logwindow;

import ai.attackframework.tools.logwindow.log.LogRecordFormatter;
import ai.attackframework.tools.logwindow.log.WindowDestination;
import ai.attackframework.tools.logwindow.ui.LogWindow;
import ai.attackframework.tools.logwindow.utils.FileUtil;
import ai.attackframework.tools.logwindow.utils.Logger;
import ai.attackframework.tools.logwindow.utils.config.Json;
import ai.attackframework.tools.logwindow.utils.config.LogWindowConfig;

import javax.swing.SwingUtilities;
import javax.swing.WindowConstants;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Standalone launcher: shows a {@link LogWindow} fed by the {@link Logger} bus.
 */
public final class LogWindowApp {

    private LogWindowApp() {}

    /**
     * Starts the window.
     *
     * @param args optional path to a JSON config file
     */
    public static void main(String[] args) {
        LogWindowConfig config = loadConfig(args.length > 0 ? Path.of(args[0]) : null);
        WindowDestination destination = createDestination(config);
        destination.attach();

        SwingUtilities.invokeLater(() -> {
            LogWindow window = new LogWindow(null, destination, config);
            window.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
            window.setVisible(true);
            Logger.logInfo("Log window started (capacity " + describeCapacity(config) + ")");
        });
    }

    /**
     * Loads the config from {@code path}; falls back to defaults when absent or unreadable.
     *
     * @param path JSON file (nullable)
     * @return config, never {@code null}
     */
    static LogWindowConfig loadConfig(Path path) {
        if (path == null) return LogWindowConfig.defaults();
        try {
            return Json.parse(FileUtil.readString(path));
        } catch (IOException | Json.ConfigJsonException e) {
            Logger.logWarn("Config " + path + " not loaded, using defaults: " + e.getMessage());
            return LogWindowConfig.defaults();
        }
    }

    /**
     * Builds the destination for {@code config}; an invalid timestamp pattern falls back to the default.
     *
     * @param config window settings
     * @return unattached destination
     */
    static WindowDestination createDestination(LogWindowConfig config) {
        LogRecordFormatter formatter;
        try {
            formatter = new LogRecordFormatter(config.timestampPattern());
        } catch (IllegalArgumentException e) {
            Logger.logWarn("Invalid timestampPattern '" + config.timestampPattern() + "', using default: " + e.getMessage());
            formatter = new LogRecordFormatter();
        }
        return new WindowDestination(config.bufferCapacity(), formatter);
    }

    private static String describeCapacity(LogWindowConfig config) {
        return config.maxItems() <= 0 ? "unbounded" : Integer.toString(config.maxItems());
    }
}
