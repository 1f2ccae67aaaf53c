package com.bot.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * One entry of {@link BotPlugin#dependencies()}: the name of another plugin and the version
 * constraint it must satisfy (e.g. {@code ">=1.2"}, {@code "==2.0"}, {@code "*"}).
 */
@Documented
@Target({})
@Retention(RetentionPolicy.RUNTIME)
public @interface Dependency {

    /** Name of the required plugin. */
    String name();

    /** Version constraint; {@code *} accepts any version. */
    String version() default "*";
}
