package ai.attackframework.tools.logwindow.log;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Levels (TRACE < DEBUG < INFO < WARN < ERROR < FATAL < OFF).
 *
 * <p>{@code OFF} is only meaningful as a threshold: no record passes it unless it is itself
 * tagged {@code OFF}.</p>
 */
public enum Level { TRACE, DEBUG, INFO, WARN, ERROR, FATAL, OFF;

    private static final List<Level> SELECTABLE =
            List.copyOf(Arrays.asList(values()).subList(0, OFF.ordinal()));

    /**
     * Parses a level name, case-insensitively.
     *
     * <p>
     * @param s level name (nullable)
     * @return the parsed level, {@link #INFO} for null or unknown names
     */
    public static Level fromString(String s) {
        if (s == null) return INFO;
        try { return Level.valueOf(s.trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException ex) { return INFO; }
    }

    /** True when this level is at or above {@code threshold}. */
    public boolean isAtLeast(Level threshold) { return ordinal() >= threshold.ordinal(); }

    /** Levels offered as display thresholds, TRACE through FATAL. */
    public static List<Level> selectable() { return SELECTABLE; }
}
