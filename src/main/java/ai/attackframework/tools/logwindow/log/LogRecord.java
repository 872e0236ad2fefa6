package ai.attackframework.tools.logwindow.log;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable log event as stored by {@link BoundedLogBuffer}.
 *
 * <p>
 * @param timestamp time of the event (required)
 * @param level     severity (required)
 * @param message   raw message text; {@code null} becomes empty
 * @param formatted display text built by {@link LogRecordFormatter}; {@code null} becomes empty
 */
public record LogRecord(LocalDateTime timestamp, Level level, String message, String formatted) {

    public LogRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(level, "level");
        message = Objects.toString(message, "");
        formatted = Objects.toString(formatted, "");
    }
}
