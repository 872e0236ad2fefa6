package ai.attackframework.tools.logwindow.log;

/**
 * Observer for {@link BoundedLogBuffer} changes.
 *
 * <p>Callbacks run on the mutating thread after the buffer lock has been released, so they may
 * read back into the buffer. Implementations that touch Swing must marshal to the EDT.</p>
 */
public interface BufferListener {

    /** A record was appended and now sits at {@code index}. */
    default void onAppended(int index) { }

    /** Rows {@code first..last} (inclusive) now hold different records; sent after an eviction. */
    default void onRangeChanged(int first, int last) { }

    /** The buffer was cleared. */
    default void onReset() { }
}
