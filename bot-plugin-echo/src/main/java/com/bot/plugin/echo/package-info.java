/**
 * Echo reference plugin.
 */
package com.bot.plugin.echo;
