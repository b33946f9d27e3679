package ru.dimension.inject;

import java.lang.annotation.*;

/**
 * Marks a parameter as supplied by the caller. It is never injected, and when the caller
 * omits it the parameter receives {@code null} (or zero / {@code false} for primitives).
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface Assisted {
}
