/**
 * Log storage behind the log window.
 *
 * <p>{@link ai.attackframework.tools.logwindow.log.BoundedLogBuffer} is a bounded FIFO written by
 * producer threads and read by the EDT under a read/write lock.
 * {@link ai.attackframework.tools.logwindow.log.LevelFilterView} projects any
 * {@link ai.attackframework.tools.logwindow.log.LeveledSequence} down to records at or above a
 * threshold, and {@link ai.attackframework.tools.logwindow.log.WindowDestination} feeds the buffer
 * from the {@link ai.attackframework.tools.logwindow.utils.Logger} bus. Nothing here touches
 * Swing.</p>
 */
package ai.attackframework.tools.logwindow.log;
