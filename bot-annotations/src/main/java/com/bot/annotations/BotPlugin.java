package com.bot.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the identity of a bot plugin. The plugin class (a subclass of
 * {@code com.bot.plugin.BasePlugin}) must carry this annotation; the host reads it when the
 * plugin is constructed and refuses plugins whose {@link #name()} or {@link #version()} is blank.
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface BotPlugin {

    /** Plugin name, unique within one host. Required. */
    String name();

    /** Plugin version (e.g. 1.0.2). Required. */
    String version();

    /** Author shown in listings. */
    String author() default "Unknown";

    /** Short description. Empty means the host uses its placeholder text. */
    String description() default "";

    /** Persisted data format: {@code json} or {@code yaml}. */
    String saveFormat() default "json";

    /** Other plugins this plugin needs, with version constraints. */
    Dependency[] dependencies() default {};
}
