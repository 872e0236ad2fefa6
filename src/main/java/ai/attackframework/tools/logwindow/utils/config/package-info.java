/**
 * Log window configuration: the typed {@link ai.attackframework.tools.logwindow.utils.config.LogWindowConfig}
 * and its JSON form ({@link ai.attackframework.tools.logwindow.utils.config.Json}).
 */
package ai.attackframework.tools.logwindow.utils.config;
