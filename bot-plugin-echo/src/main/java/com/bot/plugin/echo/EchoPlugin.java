package com.bot.plugin.echo;

import com.bot.annotations.BotPlugin;
import com.bot.event.IncomingMessage;
import com.bot.plugin.BasePlugin;
import com.bot.plugin.Conf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Reference plugin. Admins get "pong" for "ping" (the number of pings is persisted); anyone
 * gets the rest of the message back for "echo &lt;text&gt;".
 * <p>
 * Config {@code raiseOnDenied} (default false): when true, a non-admin "ping" is reported to the
 * dispatcher as a permission error instead of being ignored.
 */
@BotPlugin(name = "Echo", version = "1.0", author = "bot", description = "Replies to ping and echo")
public final class EchoPlugin extends BasePlugin {

    private static final Logger log = LoggerFactory.getLogger(EchoPlugin.class);

    static final String RAISE_ON_DENIED = "raiseOnDenied";
    static final String PINGS = "pings";
    private static final String ECHO_PREFIX = "echo\\s+";

    private final List<String> replies = new CopyOnWriteArrayList<>();

    @Override
    protected void initialize() {
        Conf raiseOnDenied = registerConfig(RAISE_ON_DENIED, false, Boolean::parseBoolean);
        boolean raise = Boolean.TRUE.equals(raiseOnDenied.getValue());
        registerAdminFunc("ping", this::ping, "ping", raise);
        registerUserFunc("echo", this::echo, ECHO_PREFIX);
        if (isFirstLoad()) {
            log.info("Echo plugin started for the first time in {}", getWorkDirectory());
        }
    }

    private void ping(IncomingMessage message) {
        lock().lock();
        try {
            Object stored = data().get(PINGS);
            int pings = stored instanceof Number n ? n.intValue() : 0;
            data().put(PINGS, pings + 1);
        } finally {
            lock().unlock();
        }
        replies.add("pong");
    }

    private void echo(IncomingMessage message) {
        replies.add(message.getRawMessage().replaceFirst(ECHO_PREFIX, ""));
    }

    /** Replies produced so far, oldest first. */
    public List<String> getReplies() {
        return List.copyOf(replies);
    }

    /** Pings answered, including those persisted by earlier runs. */
    public int getPingCount() {
        lock().lock();
        try {
            Object stored = data().get(PINGS);
            return stored instanceof Number n ? n.intValue() : 0;
        } finally {
            lock().unlock();
        }
    }
}
