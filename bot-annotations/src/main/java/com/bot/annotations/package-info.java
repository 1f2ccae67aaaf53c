/**
 * Annotations used to declare bot plugins.
 * <ul>
 *   <li>{@link com.bot.annotations.BotPlugin} – identity of a plugin class (name, version, author, save format)</li>
 *   <li>{@link com.bot.annotations.Dependency} – a dependency on another plugin with a version constraint</li>
 * </ul>
 */
package com.bot.annotations;
