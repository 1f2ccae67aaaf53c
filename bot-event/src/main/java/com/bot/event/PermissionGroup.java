package com.bot.event;

/**
 * Permission level of a caller and the level a {@link Func} requires. ADMIN callers may
 * trigger both USER and ADMIN functions; USER callers only USER functions.
 */
public enum PermissionGroup {

    USER(0),

    ADMIN(1);

    private final int level;

    PermissionGroup(int level) {
        this.level = level;
    }

    /** True if a caller holding this group may trigger a function requiring {@code required}. */
    public boolean satisfies(PermissionGroup required) {
        return required == null || level >= required.level;
    }
}
