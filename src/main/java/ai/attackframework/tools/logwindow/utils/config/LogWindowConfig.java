package ai.attackframework.tools.logwindow.utils.config;

import ai.attackframework.tools.logwindow.log.BoundedLogBuffer;
import ai.attackframework.tools.logwindow.log.Level;
import ai.attackframework.tools.logwindow.log.LogRecordFormatter;

/**
 * Typed log window configuration. Null/blank values take defaults in the constructor.
 *
 * <p>
 * @param maxItems         buffer capacity; {@code <= 0} means unbounded
 * @param minLevel         initial display threshold
 * @param autoScroll       initial auto-scroll state
 * @param timestampPattern {@link java.time.format.DateTimeFormatter} pattern for display text
 * @param title            window title
 */
public record LogWindowConfig(int maxItems, Level minLevel, boolean autoScroll, String timestampPattern, String title) {

    public static final int DEFAULT_MAX_ITEMS = 1024;
    public static final Level DEFAULT_MIN_LEVEL = Level.INFO;
    public static final String DEFAULT_TITLE = "Log";

    public LogWindowConfig {
        if (minLevel == null) minLevel = DEFAULT_MIN_LEVEL;
        if (timestampPattern == null || timestampPattern.isBlank()) timestampPattern = LogRecordFormatter.DEFAULT_PATTERN;
        if (title == null || title.isBlank()) title = DEFAULT_TITLE;
    }

    /** Defaults: 1024 records, INFO, auto-scroll on. */
    public static LogWindowConfig defaults() {
        return new LogWindowConfig(DEFAULT_MAX_ITEMS, DEFAULT_MIN_LEVEL, true, null, null);
    }

    /** Capacity to hand to {@link BoundedLogBuffer}. */
    public int bufferCapacity() {
        return maxItems <= 0 ? BoundedLogBuffer.UNBOUNDED : maxItems;
    }
}
