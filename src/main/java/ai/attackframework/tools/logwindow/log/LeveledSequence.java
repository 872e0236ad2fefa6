package ai.attackframework.tools.logwindow.log;

import java.util.ArrayList;
import java.util.List;

/**
 * Indexable, lengthed sequence of leveled records. {@link LevelFilterView} depends only on this.
 */
public interface LeveledSequence {

    /**
     * Fixed sequence over a copy of {@code records}.
     *
     * <p>
     * @param records records in order (required)
     * @return immutable sequence
     */
    static LeveledSequence of(List<LogRecord> records) {
        List<LogRecord> copy = List.copyOf(records);
        return new LeveledSequence() {
            @Override public int length() { return copy.size(); }
            @Override public LogRecord at(int index) { return copy.get(index); }
            @Override public List<LogRecord> snapshot() { return new ArrayList<>(copy); }
        };
    }

    /** Current number of records. */
    int length();

    /**
     * Returns the record at {@code index}.
     *
     * <p>
     * @param index 0-based position
     * @return record at the position
     * @throws IndexOutOfBoundsException when {@code index} is outside {@code [0, length())}
     */
    LogRecord at(int index);

    /**
     * Ordered copy of the current records.
     *
     * <p>The default walks {@link #length()} and {@link #at(int)} and stops early when the
     * sequence shrinks underneath it. Implementations with a lock should override this with an
     * atomic copy.</p>
     *
     * <p>
     * @return new list in sequence order
     */
    default List<LogRecord> snapshot() {
        int n = length();
        List<LogRecord> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            try {
                out.add(at(i));
            } catch (IndexOutOfBoundsException shrunk) {
                break;
            }
        }
        return out;
    }
}
