package com.bot.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryEventBusTest {

    private InMemoryEventBus bus;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        bus = new InMemoryEventBus();
        calls = new ArrayList<>();
    }

    private Func func(String plugin, String name, String raw, PermissionGroup permission, boolean raise) {
        return new Func(name, plugin, m -> calls.add(plugin + "." + name), null,
                raw != null ? Pattern.compile(raw) : null, permission, raise);
    }

    @Test
    void dispatch_invokesMatchingFunctionsInRegistrationOrder() {
        bus.register(func("a", "hello", "hi", PermissionGroup.USER, false));
        bus.register(func("b", "greet", "h", PermissionGroup.USER, false));
        bus.register(func("c", "bye", "bye", PermissionGroup.USER, false));

        List<String> fired = bus.dispatch(IncomingMessage.of("hi there", PermissionGroup.USER));

        assertEquals(List.of("a.hello", "b.greet"), fired);
        assertEquals(fired, calls);
    }

    @Test
    void rawFilter_isAnchoredAtStart() {
        bus.register(func("a", "ping", "ping", PermissionGroup.USER, false));

        assertTrue(bus.dispatch(IncomingMessage.of("say ping", PermissionGroup.USER)).isEmpty());
        assertEquals(List.of("a.ping"), bus.dispatch(IncomingMessage.of("ping!", PermissionGroup.USER)));
    }

    @Test
    void predicateAndPattern_mustBothAccept() {
        bus.register(new Func("grp", "a", m -> calls.add("grp"), IncomingMessage::isGroupMessage,
                Pattern.compile("/roll"), PermissionGroup.USER, false));

        assertTrue(bus.dispatch(IncomingMessage.of("/roll", PermissionGroup.USER)).isEmpty());
        IncomingMessage inGroup = IncomingMessage.builder().groupId("g1").rawMessage("/roll 6").build();
        assertEquals(List.of("a.grp"), bus.dispatch(inGroup));
    }

    @Test
    void userCaller_skipsAdminFunctionSilently() {
        bus.register(func("a", "ping", "ping", PermissionGroup.ADMIN, false));

        List<String> fired = bus.dispatch(IncomingMessage.of("ping", PermissionGroup.USER));

        assertTrue(fired.isEmpty());
        assertTrue(calls.isEmpty());
    }

    @Test
    void userCaller_getsPermissionDeniedWhenFunctionRaises() {
        bus.register(func("a", "ping", "ping", PermissionGroup.ADMIN, true));

        PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
                () -> bus.dispatch(IncomingMessage.of("ping", PermissionGroup.USER)));

        assertEquals("a.ping", e.getFunction());
        assertEquals(PermissionGroup.ADMIN, e.getRequired());
        assertEquals(PermissionGroup.USER, e.getActual());
        assertTrue(calls.isEmpty());
    }

    @Test
    void adminCaller_triggersUserAndAdminFunctions() {
        bus.register(func("a", "user", "x", PermissionGroup.USER, false));
        bus.register(func("a", "admin", "x", PermissionGroup.ADMIN, false));

        assertEquals(List.of("a.user", "a.admin"), bus.dispatch(IncomingMessage.of("x", PermissionGroup.ADMIN)));
    }

    @Test
    void defaultFunction_runsOnlyWhenNothingElseMatched() {
        bus.register(func("a", "ping", "ping", PermissionGroup.USER, false));
        bus.register(func("a", Func.DEFAULT_NAME, null, PermissionGroup.USER, false));

        assertEquals(List.of("a.ping"), bus.dispatch(IncomingMessage.of("ping", PermissionGroup.USER)));
        assertEquals(List.of("a.default"), bus.dispatch(IncomingMessage.of("something else", PermissionGroup.USER)));
    }

    @Test
    void defaultFunction_notRunWhenMatchWasRefused() {
        bus.register(func("a", "ping", "ping", PermissionGroup.ADMIN, false));
        bus.register(func("a", Func.DEFAULT_NAME, null, PermissionGroup.USER, false));

        assertTrue(bus.dispatch(IncomingMessage.of("ping", PermissionGroup.USER)).isEmpty());
    }

    @Test
    void defaultFunction_withFilterStillHonoursIt() {
        bus.register(func("a", Func.DEFAULT_NAME, "ping", PermissionGroup.USER, false));

        assertTrue(bus.dispatch(IncomingMessage.of("hello", PermissionGroup.USER)).isEmpty());
        assertEquals(List.of("a.default"), bus.dispatch(IncomingMessage.of("ping", PermissionGroup.USER)));
    }

    @Test
    void register_rejectsDuplicateWithinPlugin() {
        bus.register(func("a", "ping", "ping", PermissionGroup.USER, false));
        bus.register(func("b", "ping", "ping", PermissionGroup.USER, false));

        assertThrows(IllegalArgumentException.class, () -> bus.register(func("a", "ping", "p", PermissionGroup.USER, false)));
        assertEquals(2, bus.size());
    }

    @Test
    void unregister_removesOnlyThatFunction() {
        Func ping = func("a", "ping", "ping", PermissionGroup.USER, false);
        bus.register(ping);
        bus.register(func("b", "pong", "pong", PermissionGroup.USER, false));

        assertTrue(bus.unregister(ping));
        assertFalse(bus.unregister(ping));
        assertEquals(1, bus.size());
        assertTrue(bus.getFuncs("a").isEmpty());
        assertEquals(1, bus.getFuncs("b").size());
    }

    @Test
    void checkedHandlerFailure_isWrapped() {
        bus.register(new Func("boom", "a", m -> { throw new IOException("disk"); }, null,
                Pattern.compile("boom"), PermissionGroup.USER, false));

        DispatchException e = assertThrows(DispatchException.class,
                () -> bus.dispatch(IncomingMessage.of("boom", PermissionGroup.USER)));

        assertEquals("a.boom", e.getFunction());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void uncheckedHandlerFailure_propagatesUnchanged() {
        bus.register(new Func("boom", "a", m -> { throw new IllegalStateException("bad"); }, null,
                Pattern.compile("boom"), PermissionGroup.USER, false));

        assertThrows(IllegalStateException.class, () -> bus.dispatch(IncomingMessage.of("boom", PermissionGroup.USER)));
    }
}
