/**
 * Plugin lifecycle and registration core.
 * <ul>
 *   <li>{@link com.bot.plugin.BasePlugin} – base class with hooks and registration helpers</li>
 *   <li>{@link com.bot.plugin.PluginLifecycle} – construct / load / unload of one plugin</li>
 *   <li>{@link com.bot.plugin.PluginIdentity}, {@link com.bot.plugin.PathResolver} – identity and filesystem layout</li>
 *   <li>{@link com.bot.plugin.PersistentData} – persisted data tree with corrupt-file recovery</li>
 *   <li>{@link com.bot.plugin.FunctionRegistry}, {@link com.bot.plugin.ConfigRegistry},
 *       {@link com.bot.plugin.SchedulerBinding} – per-plugin registries</li>
 *   <li>{@link com.bot.plugin.PluginHost} – plugin set of one process, dependency ordering</li>
 * </ul>
 */
package com.bot.plugin;
