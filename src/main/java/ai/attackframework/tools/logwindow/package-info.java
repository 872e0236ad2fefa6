/**
 * Root package for the log window.
 *
 * <p>Hosts the standalone entrypoint ({@link ai.attackframework.tools.logwindow.LogWindowApp}),
 * which loads configuration, attaches a
 * {@link ai.attackframework.tools.logwindow.log.WindowDestination} to the logging bus and shows the
 * {@link ai.attackframework.tools.logwindow.ui.LogWindow}. Storage lives in {@code log}, Swing in
 * {@code ui}.</p>
 */
package ai.attackframework.tools.logwindow;
