package ai.attackframework.tools.logwindow.utils;

import ai.attackframework.tools.logwindow.log.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.AppenderBase;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * - Delegates to SLF4J so levels/appenders are configurable.
 * - Exposes a listener bus consumed by {@link ai.attackframework.tools.logwindow.log.WindowDestination} and tests.
 * - Contains a Logback appender (nested class) that forwards non-internal SLF4J events to the listener bus.
 */
public final class Logger {

    /**
     * Listener contract used by the window destination and tests.
     */
    public interface LogListener { void onLog(Level level, String message); }

    private static final String INTERNAL_LOGGER_NAME = "ai.attackframework.tools.logwindow";

    /** SLF4J has no FATAL level; FATAL events travel as ERROR with this marker. */
    public static final Marker FATAL = MarkerFactory.getMarker("FATAL");

    private static final org.slf4j.Logger LOG =
            LoggerFactory.getLogger(INTERNAL_LOGGER_NAME);

    private static final CopyOnWriteArrayList<LogListener> LISTENERS = new CopyOnWriteArrayList<>();

    /**
     * Utility holder; not instantiable.
     */
    private Logger() {}

    /**
     * Registers a log listener; registering the same listener twice has no effect.
     * <p>
     * @param listener listener to add (nullable ignored)
     */
    public static void registerListener(LogListener listener) { if (listener != null) LISTENERS.addIfAbsent(listener); }

    /**
     * Unregisters a log listener.
     * <p>
     * @param listener listener to remove (nullable ignored)
     */
    public static void unregisterListener(LogListener listener) { LISTENERS.remove(listener); }

    // -------- Public API (mirrored to the listener bus) --------

    /**
     * Logs at TRACE (when enabled) and mirrors to listeners.
     * <p>
     * @param msg message to log
     */
    public static void logTrace(String msg) {
        final String m = safe(msg);
        if (LOG.isTraceEnabled()) LOG.trace(m);
        notifyListeners(Level.TRACE, m);
    }

    /**
     * Logs at DEBUG (when enabled) and mirrors to listeners.
     * <p>
     * @param msg message to log
     */
    public static void logDebug(String msg) {
        final String m = safe(msg);
        if (LOG.isDebugEnabled()) LOG.debug(m);
        notifyListeners(Level.DEBUG, m);
    }

    /**
     * Logs at INFO and mirrors to listeners.
     * <p>
     * @param msg message to log
     */
    public static void logInfo(String msg)  {
        final String m = safe(msg);
        LOG.info(m);
        notifyListeners(Level.INFO, m);
    }

    /**
     * Logs at WARN and mirrors to listeners.
     * <p>
     * @param msg message to log
     */
    public static void logWarn(String msg)  {
        final String m = safe(msg);
        LOG.warn(m);
        notifyListeners(Level.WARN, m);
    }

    /**
     * Logs at ERROR and mirrors to listeners.
     * <p>
     * @param msg message to log
     */
    public static void logError(String msg) {
        final String m = safe(msg);
        LOG.error(m);
        notifyListeners(Level.ERROR, m);
    }

    /**
     * Logs at ERROR with throwable, mirrors concise summary to listeners.
     * <p>
     * @param msg message to log
     * @param t   throwable (nullable)
     */
    public static void logError(String msg, Throwable t) {
        final String base = safe(msg);
        final String uiMessage = base + summary(t);
        LOG.error(base, t);                    // stack trace handled by backend
        notifyListeners(Level.ERROR, uiMessage);
    }

    /**
     * Logs at ERROR with the {@link #FATAL} marker and mirrors to listeners as FATAL.
     * <p>
     * @param msg message to log
     */
    public static void logFatal(String msg) {
        final String m = safe(msg);
        LOG.error(FATAL, m);
        notifyListeners(Level.FATAL, m);
    }

    /**
     * Allows logging backends to forward events into the listener bus.
     * <p>
     * @param level   event level
     * @param message message to emit
     */
    public static void emitToListeners(Level level, String message) {
        notifyListeners(level == null ? Level.INFO : level, safe(message));
    }

    // -------- Internal-only API (NO listener mirroring) --------
    // Used by the buffer and the UI so the window never logs into itself.

    /** Logs at INFO without notifying listeners. */
    public static void internalInfo(String msg)  { if (LOG.isInfoEnabled())  LOG.info(safe(msg)); }
    /** Logs at WARN without notifying listeners. */
    public static void internalWarn(String msg)  { if (LOG.isWarnEnabled())  LOG.warn(safe(msg)); }
    /** Logs at DEBUG without notifying listeners. */
    public static void internalDebug(String msg) { if (LOG.isDebugEnabled()) LOG.debug(safe(msg)); }
    /** Logs at TRACE without notifying listeners. */
    public static void internalTrace(String msg) { if (LOG.isTraceEnabled()) LOG.trace(safe(msg)); }

    // -------- Internals --------

    /**
     * Dispatches a message to registered listeners.
     * <p>
     * @param level event level
     * @param m     message text
     */
    private static void notifyListeners(Level level, String m) {
        for (LogListener l : LISTENERS) {
            try { l.onLog(level, m); }
            catch (RuntimeException ex) {
                if (LOG.isDebugEnabled()) LOG.debug("listener threw: {}", ex.toString());
            }
        }
    }

    private static String summary(Throwable t) {
        return t != null ? " :: " + t.getClass().getSimpleName() + ": " + safe(t.getMessage()) : "";
    }

    /**
     * Null-safe string conversion.
     * <p>
     * @param s input string
     * @return non-null string
     */
    private static String safe(String s) { return Objects.toString(s, ""); }

    // --------------------------------------------
    // Logback appender that feeds the listener bus
    // --------------------------------------------

    /**
     * Logback appender that forwards non-internal events to the listener bus.
     */
    public static final class UiAppender extends AppenderBase<ILoggingEvent> {
        /**
         * Forwards the event to listeners, skipping internal logger entries.
         * <p>
         * @param event logback event
         */
        @Override
        protected void append(ILoggingEvent event) {
            if (event == null) return;

            // Skip messages from our internal logger; those already notify the bus directly.
            if (INTERNAL_LOGGER_NAME.equals(event.getLoggerName())) return;

            String message = event.getFormattedMessage();
            if (message == null) message = "";

            IThrowableProxy tp = event.getThrowableProxy();
            if (tp != null) {
                String exClass = tp.getClassName();
                String exMsg = tp.getMessage();
                message = message + " :: " + (exClass != null ? exClass : "Exception")
                        + (exMsg != null ? (": " + exMsg) : "");
            }

            Logger.emitToListeners(levelOf(event), message);
        }

        private static Level levelOf(ILoggingEvent event) {
            List<Marker> markers = event.getMarkerList();
            if (markers != null) {
                for (Marker m : markers) {
                    if (m != null && m.contains(FATAL)) return Level.FATAL;
                }
            }
            return (event.getLevel() != null) ? Level.fromString(event.getLevel().toString()) : Level.INFO;
        }
    }
}
