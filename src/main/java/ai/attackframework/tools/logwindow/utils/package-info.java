/**
 * Common utilities shared across the log window.
 *
 * <p>Includes logging ({@link ai.attackframework.tools.logwindow.utils.Logger}) and filesystem
 * helpers. These classes are UI-agnostic; callers may use them from background threads as
 * needed.</p>
 */
package ai.attackframework.tools.logwindow.utils;
