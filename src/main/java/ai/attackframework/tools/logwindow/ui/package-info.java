/**
 * Swing front end of the log window.
 *
 * <p>{@link ai.attackframework.tools.logwindow.ui.LogTableModel} adapts a
 * {@link ai.attackframework.tools.logwindow.log.BoundedLogBuffer} to {@code JTable}, applying the
 * level threshold and pause state. {@link ai.attackframework.tools.logwindow.ui.LogPanel} owns the
 * toolbar and table; {@link ai.attackframework.tools.logwindow.ui.LogWindow} is the dialog around
 * it.</p>
 *
 * <p>All UI construction and mutation occur on the EDT; buffer notifications are marshaled with
 * {@code invokeLater}.</p>
 */
package ai.attackframework.tools.logwindow.ui;
