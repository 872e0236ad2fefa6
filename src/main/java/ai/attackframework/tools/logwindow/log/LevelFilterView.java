package ai.attackframework.tools.logwindow.log;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Read-only projection of a {@link LeveledSequence} that keeps records at or above a threshold.
 *
 * <p>Every query scans one snapshot of the source, so threshold and source changes show up on
 * the next call. Results of separate calls may disagree when the source changes in between;
 * callers that need a consistent view should use {@link #visibleIndices()} or
 * {@link #visibleRecords()} once.</p>
 */
public final class LevelFilterView {

    private final LeveledSequence source;
    private volatile Level threshold;

    /**
     * Creates a view over {@code source}.
     *
     * <p>
     * @param source    sequence to project (held by reference, required)
     * @param threshold initial minimum level (required)
     */
    public LevelFilterView(LeveledSequence source, Level threshold) {
        this.source = Objects.requireNonNull(source, "source");
        this.threshold = Objects.requireNonNull(threshold, "threshold");
    }

    public Level threshold() { return threshold; }

    /**
     * Changes the minimum level; takes effect on the next query.
     * <p>
     * @param level new threshold (required)
     */
    public void setThreshold(Level level) { this.threshold = Objects.requireNonNull(level, "level"); }

    /** True when a record of {@code level} passes the current threshold. */
    public boolean accepts(Level level) { return level.isAtLeast(threshold); }

    /** Number of source records with level at or above the threshold. */
    public int visibleCount() {
        Level min = threshold;
        int n = 0;
        for (LogRecord r : source.snapshot()) {
            if (r.level().isAtLeast(min)) n++;
        }
        return n;
    }

    /**
     * Translates a position in the filtered view into a source index.
     *
     * <p>
     * @param visibleIndex 0-based position among visible records
     * @return index into the source sequence
     * @throws IndexOutOfBoundsException when {@code visibleIndex} is outside {@code [0, visibleCount())}
     */
    public int mapVisibleToSource(int visibleIndex) {
        if (visibleIndex < 0) throw new IndexOutOfBoundsException("visibleIndex " + visibleIndex + " < 0");
        Level min = threshold;
        List<LogRecord> rows = source.snapshot();
        int seen = 0;
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).level().isAtLeast(min) && seen++ == visibleIndex) return i;
        }
        throw new IndexOutOfBoundsException("visibleIndex " + visibleIndex + " out of bounds for visible count " + seen);
    }

    /** Source indices of all visible records, ascending, from one snapshot. */
    public int[] visibleIndices() {
        Level min = threshold;
        List<LogRecord> rows = source.snapshot();
        int[] out = new int[rows.size()];
        int n = 0;
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).level().isAtLeast(min)) out[n++] = i;
        }
        return Arrays.copyOf(out, n);
    }

    /** Visible records in source order, from one snapshot. */
    public List<LogRecord> visibleRecords() {
        Level min = threshold;
        List<LogRecord> out = new ArrayList<>();
        for (LogRecord r : source.snapshot()) {
            if (r.level().isAtLeast(min)) out.add(r);
        }
        return out;
    }
}
