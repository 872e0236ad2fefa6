package ai.attackframework.tools.logwindow.log;

import ai.attackframework.tools.logwindow.utils.Logger;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Log destination backing the log window: turns bus events into formatted records and appends
 * them to a {@link BoundedLogBuffer}.
 *
 * <p><strong>Threading:</strong> {@link #onLog} runs on whichever thread logged; the buffer
 * serializes concurrent producers.</p>
 */
public final class WindowDestination implements Logger.LogListener {

    /** Destination type name. */
    public static final String TYPE = "window";

    private final BoundedLogBuffer buffer;
    private final LogRecordFormatter formatter;

    /**
     * Creates a destination with its own buffer.
     *
     * <p>
     * @param maxItems  buffer capacity (> 0), or {@link BoundedLogBuffer#UNBOUNDED}
     * @param formatter formatter for display text (required)
     */
    public WindowDestination(int maxItems, LogRecordFormatter formatter) {
        this.buffer = new BoundedLogBuffer(maxItems);
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    @Override
    public void onLog(Level level, String message) {
        write(formatter.record(LocalDateTime.now(), level == null ? Level.INFO : level, message));
    }

    /**
     * Appends a prepared record.
     * <p>
     * @param record record to store (required)
     */
    public void write(LogRecord record) { buffer.append(record); }

    /** Removes all buffered records. */
    public void clear() {
        buffer.clear();
        Logger.internalDebug("WindowDestination cleared");
    }

    /** Subscribes to the {@link Logger} bus. */
    public void attach() { Logger.registerListener(this); }

    /** Unsubscribes from the {@link Logger} bus. */
    public void detach() { Logger.unregisterListener(this); }

    public BoundedLogBuffer buffer() { return buffer; }

    public LogRecordFormatter formatter() { return formatter; }

    public boolean isValid() { return true; }

    public String type() { return TYPE; }
}
