package ai.attackframework.tools.logwindow.log;

import ai.attackframework.tools.logwindow.utils.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded FIFO of log records: oldest entries are evicted once the capacity is exceeded.
 *
 * <p>Storage is a ring that grows by doubling up to the capacity, so append and eviction are
 * O(1).</p>
 *
 * <p><strong>Threading:</strong> {@link #append} and {@link #clear} take the write lock; reads
 * take the read lock and may run concurrently. Listeners are notified after the lock has been
 * released, on the mutating thread.</p>
 */
public final class BoundedLogBuffer implements LeveledSequence {

    /** Capacity value meaning "no limit". */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final int INITIAL_SLOTS = 16;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final CopyOnWriteArrayList<BufferListener> listeners = new CopyOnWriteArrayList<>();
    private final int capacity;

    // guarded by lock
    private LogRecord[] slots;
    private int head;   // slot of the oldest record
    private int size;

    /**
     * Creates an empty buffer.
     *
     * <p>
     * @param capacity maximum records retained (> 0), or {@link #UNBOUNDED}
     */
    public BoundedLogBuffer(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
        this.slots = new LogRecord[Math.min(capacity, INITIAL_SLOTS)];
    }

    /** Creates a buffer with no capacity limit. */
    public static BoundedLogBuffer unbounded() { return new BoundedLogBuffer(UNBOUNDED); }

    public int capacity() { return capacity; }

    public boolean isBounded() { return capacity != UNBOUNDED; }

    /**
     * Appends a record, evicting the oldest one when the capacity is exceeded.
     *
     * <p>Notifies {@link BufferListener#onAppended} and, after an eviction,
     * {@link BufferListener#onRangeChanged} for the whole range.</p>
     *
     * <p>
     * @param record record to append (required)
     */
    public void append(LogRecord record) {
        Objects.requireNonNull(record, "record");
        final int index;
        final boolean evicted;

        lock.writeLock().lock();
        try {
            if (size == slots.length && size < capacity) grow();
            if (size == capacity) {
                // full: overwrite the oldest slot and advance head
                slots[head] = record;
                head = (head + 1) % slots.length;
                evicted = true;
            } else {
                slots[(head + size) % slots.length] = record;
                size++;
                evicted = false;
            }
            index = size - 1;
        } finally {
            lock.writeLock().unlock();
        }

        for (BufferListener l : listeners) {
            try { l.onAppended(index); }
            catch (RuntimeException ex) { Logger.internalDebug("BoundedLogBuffer listener threw on append: " + ex); }
        }
        if (evicted) {
            for (BufferListener l : listeners) {
                try { l.onRangeChanged(0, index); }
                catch (RuntimeException ex) { Logger.internalDebug("BoundedLogBuffer listener threw on range change: " + ex); }
            }
        }
    }

    /**
     * Returns the record at {@code index}, 0 being the oldest.
     *
     * <p>
     * @throws IndexOutOfBoundsException when {@code index} is outside {@code [0, length())};
     *         the buffer may have been cleared concurrently, callers should re-query
     */
    @Override
    public LogRecord at(int index) {
        lock.readLock().lock();
        try {
            Objects.checkIndex(index, size);
            return slots[(head + index) % slots.length];
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int length() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Atomic, ordered copy of the current contents. */
    @Override
    public List<LogRecord> snapshot() {
        lock.readLock().lock();
        try {
            List<LogRecord> out = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                out.add(slots[(head + i) % slots.length]);
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes all records; capacity is unchanged. Notifies {@link BufferListener#onReset}.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            slots = new LogRecord[Math.min(capacity, INITIAL_SLOTS)];
            head = 0;
            size = 0;
        } finally {
            lock.writeLock().unlock();
        }

        for (BufferListener l : listeners) {
            try { l.onReset(); }
            catch (RuntimeException ex) { Logger.internalDebug("BoundedLogBuffer listener threw on reset: " + ex); }
        }
    }

    /**
     * Registers a change listener; registering the same listener twice has no effect.
     * <p>
     * @param listener listener to add (nullable ignored)
     */
    public void subscribe(BufferListener listener) { if (listener != null) listeners.addIfAbsent(listener); }

    /**
     * Unregisters a change listener.
     * <p>
     * @param listener listener to remove (nullable ignored)
     */
    public void unsubscribe(BufferListener listener) { listeners.remove(listener); }

    // Caller holds the write lock; ring is full, so unroll it from head into a larger array.
    private void grow() {
        int newLength = (int) Math.min((long) slots.length * 2, capacity);
        LogRecord[] next = new LogRecord[newLength];
        System.arraycopy(slots, head, next, 0, slots.length - head);
        System.arraycopy(slots, 0, next, slots.length - head, head);
        slots = next;
        head = 0;
    }
}
