/**
 * Event bus contracts and a simple in-process dispatcher.
 * <ul>
 *   <li>{@link com.bot.event.Func} – named, permission-scoped, filter-gated handler</li>
 *   <li>{@link com.bot.event.EventBus} – register/unregister surface used by plugins</li>
 *   <li>{@link com.bot.event.InMemoryEventBus} – ordered registry plus synchronous dispatch</li>
 *   <li>{@link com.bot.event.PermissionGroup} – USER / ADMIN</li>
 * </ul>
 */
package com.bot.event;
