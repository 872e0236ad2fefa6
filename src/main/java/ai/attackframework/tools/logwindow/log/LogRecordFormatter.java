package ai.attackframework.tools.logwindow.log;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Formats records into single display lines and time-column text.
 *
 * <p>Stateless after construction; safe to share between the producer and the EDT.</p>
 */
public final class LogRecordFormatter {

    /** Default timestamp pattern, millisecond precision. */
    public static final String DEFAULT_PATTERN = "yyyy-MM-dd HH:mm:ss.SSS";

    private final String pattern;
    private final DateTimeFormatter ts;

    /** Creates a formatter using {@link #DEFAULT_PATTERN}. */
    public LogRecordFormatter() { this(DEFAULT_PATTERN); }

    /**
     * Creates a formatter for the given timestamp pattern.
     *
     * <p>
     * @param pattern {@link DateTimeFormatter} pattern (required)
     * @throws IllegalArgumentException when the pattern is invalid
     */
    public LogRecordFormatter(String pattern) {
        this.ts = DateTimeFormatter.ofPattern(Objects.requireNonNull(pattern, "pattern"));
        this.pattern = pattern;
    }

    public String pattern() { return pattern; }

    /**
     * Builds a record stamped with {@code ts} whose display text comes from {@link #formatLine}.
     *
     * <p>
     * @param ts    timestamp (fallbacks to now when null)
     * @param level log level (required)
     * @param msg   log message (nullable)
     * @return immutable record
     */
    public LogRecord record(LocalDateTime ts, Level level, String msg) {
        LocalDateTime when = ts == null ? LocalDateTime.now() : ts;
        return new LogRecord(when, level, msg, formatLine(when, level, msg));
    }

    /**
     * Formats a log entry into a single line without trailing newline.
     *
     * <p>
     * @param ts  timestamp (fallbacks to now when null)
     * @param lvl log level
     * @param msg log message (nullable)
     * @return formatted line
     */
    public String formatLine(LocalDateTime ts, Level lvl, String msg) {
        return String.format("[%s] [%s] %s", formatTime(ts), lvl.name(), msg == null ? "" : msg);
    }

    /** Formats only the timestamp; null means now. */
    public String formatTime(LocalDateTime ts) {
        return this.ts.format(ts == null ? LocalDateTime.now() : ts);
    }
}
