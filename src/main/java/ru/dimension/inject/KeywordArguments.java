package ru.dimension.inject;

import java.lang.annotation.*;

/**
 * Collects keyword arguments that match no other parameter. Only valid on a
 * {@code Map<String, Object>} parameter, at most one per method.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface KeywordArguments {
}
