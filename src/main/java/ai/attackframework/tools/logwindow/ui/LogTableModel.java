package ai.attackframework.tools.logwindow.ui;

import ai.attackframework.tools.logwindow.log.BoundedLogBuffer;
import ai.attackframework.tools.logwindow.log.BufferListener;
import ai.attackframework.tools.logwindow.log.LevelFilterView;
import ai.attackframework.tools.logwindow.log.Level;
import ai.attackframework.tools.logwindow.log.LeveledSequence;
import ai.attackframework.tools.logwindow.log.LogRecord;
import ai.attackframework.tools.logwindow.log.LogRecordFormatter;
import ai.attackframework.tools.logwindow.utils.Logger;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import javax.swing.SwingUtilities;
import javax.swing.table.AbstractTableModel;
import java.awt.Color;
import java.io.Serial;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Table model showing the records of a {@link BoundedLogBuffer} that pass a level threshold.
 *
 * <p><strong>Design:</strong> rows are a snapshot taken from a {@link LevelFilterView} on each
 * refresh, so the table never indexes the live buffer with stale positions. Buffer events are
 * coalesced into one {@code invokeLater} refresh. While paused, the view filters a frozen copy
 * of the buffer and buffer events are deferred until resume.</p>
 *
 * <p><strong>Threading:</strong> construct and call on the EDT; buffer callbacks may arrive on
 * any thread.</p>
 */
public final class LogTableModel extends AbstractTableModel implements BufferListener {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final int COL_TIME    = 0;
    public static final int COL_LEVEL   = 1;
    public static final int COL_MESSAGE = 2;
    private static final String[] COLUMNS = {"Time", "Level", "Message"};

    private static final Color WARN_BG  = new Color(255, 255, 128);
    private static final Color ERROR_BG = new Color(255, 128, 128);
    private static final Color FATAL_BG = new Color(255, 0, 0);

    @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "The model observes the shared buffer by reference and never re-exposes it.")
    private final transient BoundedLogBuffer buffer;
    private final transient LevelFilterView live;
    private final transient LogRecordFormatter formatter;

    private final AtomicBoolean refreshQueued = new AtomicBoolean();
    private final AtomicBoolean resetPending  = new AtomicBoolean();

    // EDT only
    private transient LevelFilterView frozen;
    private transient List<LogRecord> rows;

    /**
     * Creates the model and subscribes it to {@code buffer}.
     *
     * <p>
     * @param buffer    record source (required)
     * @param threshold initial minimum level (required)
     * @param formatter formatter for the time column (required)
     */
    public LogTableModel(BoundedLogBuffer buffer, Level threshold, LogRecordFormatter formatter) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.live = new LevelFilterView(buffer, threshold);
        this.rows = live.visibleRecords();
        buffer.subscribe(this);
    }

    // ---- BufferListener (any thread) ----

    @Override public void onAppended(int index) { scheduleRefresh(); }

    @Override public void onRangeChanged(int first, int last) { scheduleRefresh(); }

    @Override
    public void onReset() {
        resetPending.set(true);
        scheduleRefresh();
    }

    private void scheduleRefresh() {
        if (refreshQueued.compareAndSet(false, true)) {
            SwingUtilities.invokeLater(this::refresh);
        }
    }

    // ---- State (EDT) ----

    /** Re-reads the buffer unless paused. */
    void refresh() {
        refreshQueued.set(false);
        if (frozen != null) return;
        apply(live.visibleRecords(), resetPending.getAndSet(false));
    }

    /**
     * Changes the minimum level and re-filters immediately, also while paused.
     * <p>
     * @param level new threshold (required)
     */
    public void setThreshold(Level level) {
        live.setThreshold(level);
        if (frozen != null) frozen.setThreshold(level);
        Logger.internalDebug("LogTableModel threshold=" + level);
        apply(current().visibleRecords(), true);
    }

    public Level threshold() { return live.threshold(); }

    /**
     * Freezes or unfreezes the displayed rows.
     * <p>
     * @param paused {@code true} to stop following the buffer
     */
    public void setPaused(boolean paused) {
        if (paused == isPaused()) return;
        if (paused) {
            frozen = new LevelFilterView(LeveledSequence.of(buffer.snapshot()), live.threshold());
            apply(frozen.visibleRecords(), false);
        } else {
            frozen = null;
            refresh();
        }
        Logger.internalDebug("LogTableModel paused=" + paused);
    }

    public boolean isPaused() { return frozen != null; }

    private LevelFilterView current() { return frozen != null ? frozen : live; }

    private void apply(List<LogRecord> next, boolean reset) {
        List<LogRecord> prev = rows;
        rows = next;
        int before = prev.size();
        int after = next.size();

        if (reset || after < before) {
            fireTableDataChanged();
            return;
        }
        if (!samePrefix(prev, next) && before > 0) {
            // eviction shifted every row
            fireTableRowsUpdated(0, before - 1);
        }
        if (after > before) {
            fireTableRowsInserted(before, after - 1);
        }
    }

    private static boolean samePrefix(List<LogRecord> prev, List<LogRecord> next) {
        for (int i = 0; i < prev.size(); i++) {
            if (prev.get(i) != next.get(i)) return false;
        }
        return true;
    }

    // ---- Accessors (EDT) ----

    /**
     * Record shown at {@code row}.
     * <p>
     * @throws IndexOutOfBoundsException when {@code row} is outside {@code [0, getRowCount())}
     */
    public LogRecord recordAt(int row) { return rows.get(row); }

    /** Records currently shown, in display order. */
    public List<LogRecord> visibleRecords() { return List.copyOf(rows); }

    /** Records held by the buffer regardless of the threshold. */
    public int totalCount() { return buffer.length(); }

    /** Row background for a level; {@code null} means the table default. */
    public static Color backgroundFor(Level level) {
        if (level == null) return null;
        return switch (level) {
            case WARN -> WARN_BG;
            case ERROR -> ERROR_BG;
            case FATAL -> FATAL_BG;
            default -> null;
        };
    }

    /** Observes the buffer again after {@link #dispose()} and catches up with it. */
    public void attach() {
        buffer.subscribe(this);
        refresh();
    }

    /** Stops observing the buffer. */
    public void dispose() { buffer.unsubscribe(this); }

    // ---- AbstractTableModel ----

    @Override public int getRowCount() { return rows.size(); }

    @Override public int getColumnCount() { return COLUMNS.length; }

    @Override public String getColumnName(int column) { return COLUMNS[column]; }

    @Override public Class<?> getColumnClass(int columnIndex) { return String.class; }

    @Override
    public Object getValueAt(int rowIndex, int columnIndex) {
        if (rowIndex < 0 || rowIndex >= rows.size()) return null;
        LogRecord r = rows.get(rowIndex);
        return switch (columnIndex) {
            case COL_TIME -> formatter.formatTime(r.timestamp());
            case COL_LEVEL -> r.level().name();
            case COL_MESSAGE -> r.message();
            default -> null;
        };
    }
}
