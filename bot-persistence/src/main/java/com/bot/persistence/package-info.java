/**
 * Persistence of plugin data trees.
 * <ul>
 *   <li>{@link com.bot.persistence.PersistenceEngine} – load/save contract, consumed by the plugin core</li>
 *   <li>{@link com.bot.persistence.JacksonPersistenceEngine} – JSON and YAML implementation</li>
 *   <li>{@link com.bot.persistence.SaveFormat} – supported formats and file extensions</li>
 *   <li>{@link com.bot.persistence.PersistenceException} and subclasses – unknown format, load, save, missing file</li>
 *   <li>{@link com.bot.persistence.TreeView} – text rendering of a data tree (debug mode)</li>
 * </ul>
 */
package com.bot.persistence;
