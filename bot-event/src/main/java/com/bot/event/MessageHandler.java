package com.bot.event;

/**
 * Callable behind a {@link Func}; invoked by the dispatcher with the message that matched.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(IncomingMessage message) throws Exception;
}
