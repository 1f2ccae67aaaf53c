package com.bot.event;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FuncTest {

    private static final MessageHandler NOOP = m -> { };

    @Test
    void defaults_permissionToUser() {
        Func func = new Func("f", "p", NOOP, null, Pattern.compile("x"), null, false);

        assertEquals(PermissionGroup.USER, func.getPermission());
        assertEquals("p.f", func.getQualifiedName());
        assertTrue(func.hasFilter());
        assertFalse(func.isDefault());
    }

    @Test
    void defaultFunction_hasNoFilterAndMatchesEverything() {
        Func func = new Func(Func.DEFAULT_NAME, "p", NOOP, null, null, PermissionGroup.USER, false);

        assertTrue(func.isDefault());
        assertFalse(func.hasFilter());
        assertTrue(func.matches(IncomingMessage.of("anything", PermissionGroup.USER)));
        assertFalse(func.matches(null));
    }

    @Test
    void requiresNameOwnerAndHandler() {
        assertThrows(NullPointerException.class, () -> new Func(null, "p", NOOP, null, null, null, false));
        assertThrows(NullPointerException.class, () -> new Func("f", null, NOOP, null, null, null, false));
        assertThrows(NullPointerException.class, () -> new Func("f", "p", null, null, null, null, false));
    }

    @Test
    void permissionGroup_satisfies() {
        assertTrue(PermissionGroup.ADMIN.satisfies(PermissionGroup.USER));
        assertTrue(PermissionGroup.ADMIN.satisfies(PermissionGroup.ADMIN));
        assertTrue(PermissionGroup.USER.satisfies(PermissionGroup.USER));
        assertFalse(PermissionGroup.USER.satisfies(PermissionGroup.ADMIN));
    }
}
