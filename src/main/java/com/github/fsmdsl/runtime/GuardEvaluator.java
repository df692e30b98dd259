package com.github.fsmdsl.runtime;

/**
 * Decides whether a guard or choice condition holds. Guard text is opaque to the DSL; the
 * embedding application resolves it, typically through a table keyed by the text.
 *
 * Implementations may throw: callers treat any exception as {@code false} for that guard only.
 */
@FunctionalInterface
public interface GuardEvaluator {

  boolean evaluate(String guard, Object payload) throws Exception;
}
