package ai.attackframework.tools.logwindow.log;

import java.util.List;

/**
 * Text export of records in display order. No I/O; callers decide where the text goes.
 */
public final class LogExport {

    private LogExport() {}

    /**
     * Concatenates {@link LogRecord#formatted()} of each record, one line each.
     *
     * <p>
     * @param records records in display order (nullable entries skipped)
     * @return text with a trailing newline per record, empty for no records
     */
    public static String toText(List<LogRecord> records) {
        if (records == null || records.isEmpty()) return "";
        StringBuilder sb = new StringBuilder(records.size() * 64);
        for (LogRecord r : records) {
            if (r != null) sb.append(r.formatted()).append('\n');
        }
        return sb.toString();
    }
}
