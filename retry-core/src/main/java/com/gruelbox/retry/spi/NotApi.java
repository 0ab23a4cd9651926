package com.gruelbox.retry.spi;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Signifies that a public class or method is not intended for client use. Such classes and methods
 * exist so that driver modules (such as the Reactor integration) can share the retry machinery,
 * are not subject to any semver guarantees and may be broken without warning.
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface NotApi {}
