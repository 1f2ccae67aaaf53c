package com.bot.plugin.echo;

import com.bot.config.BotConfig;
import com.bot.event.InMemoryEventBus;
import com.bot.event.IncomingMessage;
import com.bot.event.PermissionDeniedException;
import com.bot.event.PermissionGroup;
import com.bot.plugin.LifecycleState;
import com.bot.plugin.PluginCollaborators;
import com.bot.plugin.PluginHost;
import com.bot.plugin.PluginLifecycle;
import com.bot.plugin.PluginOptions;
import com.bot.scheduler.ExecutorTaskScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EchoPluginTest {

    @TempDir
    Path tempDir;

    private InMemoryEventBus bus;
    private ExecutorTaskScheduler scheduler;
    private PluginCollaborators collaborators;

    @BeforeEach
    void setUp() {
        bus = new InMemoryEventBus();
        scheduler = new ExecutorTaskScheduler();
        collaborators = PluginCollaborators.of(bus, scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    private PluginOptions options() {
        return PluginOptions.builder()
                .persistentRoot(tempDir.resolve("data"))
                .sourceDirectory(tempDir.resolve("plugins/demo"))
                .build();
    }

    private PluginLifecycle<EchoPlugin> loadEcho() throws Exception {
        PluginLifecycle<EchoPlugin> lifecycle = PluginLifecycle.construct(EchoPlugin.class, collaborators, options());
        lifecycle.load().get(5, TimeUnit.SECONDS);
        return lifecycle;
    }

    @Test
    void adminPingIsAnswered() throws Exception {
        PluginLifecycle<EchoPlugin> echo = loadEcho();

        List<String> fired = bus.dispatch(IncomingMessage.of("ping", PermissionGroup.ADMIN));

        assertEquals(List.of("Echo.ping"), fired);
        assertEquals(List.of("pong"), echo.plugin().getReplies());
        assertEquals(1, echo.plugin().getPingCount());
    }

    @Test
    void userPingIsIgnoredWithoutError() throws Exception {
        PluginLifecycle<EchoPlugin> echo = loadEcho();

        List<String> fired = bus.dispatch(IncomingMessage.of("ping", PermissionGroup.USER));

        assertTrue(fired.isEmpty());
        assertTrue(echo.plugin().getReplies().isEmpty());
    }

    @Test
    void userPingIsReportedWhenRaiseIsConfigured() throws Exception {
        Files.createDirectories(tempDir.resolve("data/demo"));
        Files.writeString(tempDir.resolve("data/demo/demo.json"), "{\"config\": {\"raiseOnDenied\": true}}");
        PluginLifecycle<EchoPlugin> echo = loadEcho();

        PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
                () -> bus.dispatch(IncomingMessage.of("ping", PermissionGroup.USER)));

        assertEquals("Echo.ping", e.getFunction());
        assertEquals(PermissionGroup.ADMIN, e.getRequired());
        assertTrue(echo.plugin().getReplies().isEmpty());
    }

    @Test
    void echoRepliesToAnyone() throws Exception {
        PluginLifecycle<EchoPlugin> echo = loadEcho();

        bus.dispatch(IncomingMessage.of("echo hello there", PermissionGroup.USER));

        assertEquals(List.of("hello there"), echo.plugin().getReplies());
    }

    @Test
    void pingCountSurvivesRestartAndFirstLoadFlips() throws Exception {
        PluginLifecycle<EchoPlugin> first = loadEcho();
        assertTrue(first.plugin().isFirstLoad());
        bus.dispatch(IncomingMessage.of("ping", PermissionGroup.ADMIN));
        bus.dispatch(IncomingMessage.of("ping", PermissionGroup.ADMIN));
        first.unload().get(5, TimeUnit.SECONDS);
        assertEquals(0, bus.size());

        PluginLifecycle<EchoPlugin> second = loadEcho();

        assertFalse(second.plugin().isFirstLoad());
        assertEquals(2, second.plugin().getPingCount());
        assertEquals(Boolean.FALSE, second.plugin().getConfigs().get(0).getValue());
    }

    @Test
    void hostRunsEchoEndToEnd() {
        BotConfig config = BotConfig.builder().persistentDir(tempDir.resolve("host").toString()).build();
        PluginLifecycle<EchoPlugin> echo;
        try (PluginHost host = new PluginHost(config, bus, scheduler)) {
            echo = host.register(EchoPlugin.class, PluginOptions.builder()
                    .persistentRoot(tempDir.resolve("host"))
                    .sourceDirectory(tempDir.resolve("plugins/echo"))
                    .build());
            assertEquals(List.of("Echo"), host.loadAll());

            assertEquals(List.of("Echo.ping"), bus.dispatch(IncomingMessage.of("ping", PermissionGroup.ADMIN)));
        }

        assertEquals(LifecycleState.UNLOADED, echo.getState());
        assertTrue(Files.exists(tempDir.resolve("host/echo/echo.json")));
    }
}
