package com.github.fsmdsl.sim;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmdsl.runtime.GuardEvaluator;

/**
 * Guard evaluator backed by a fixed table of guard text to predicate over the event payload. A
 * guard with no entry evaluates to false.
 */
public final class GuardTable implements GuardEvaluator {
  private static final Logger logger = LogManager.getLogger(GuardTable.class.getSimpleName());

  private final Map<String, Predicate<Object>> predicates;

  private GuardTable(final Map<String, Predicate<Object>> predicates) {
    this.predicates = Collections.unmodifiableMap(new LinkedHashMap<>(predicates));
  }

  public static GuardTable empty() {
    return new GuardTable(Collections.<String, Predicate<Object>>emptyMap());
  }

  @Override
  public boolean evaluate(final String guard, final Object payload) {
    final Predicate<Object> predicate = predicates.get(guard);
    if (predicate == null) {
      if (logger.isDebugEnabled()) {
        logger.debug("No entry for guard [" + guard + "], evaluating to false");
      }
      return false;
    }
    return predicate.test(payload);
  }

  public boolean contains(final String guard) {
    return predicates.containsKey(guard);
  }

  @Override
  public String toString() {
    return "GuardTable [guards=" + predicates.keySet() + "]";
  }

  public final static class GuardTableBuilder {
    private final Map<String, Predicate<Object>> predicates = new LinkedHashMap<>();

    public static GuardTableBuilder newBuilder() {
      return new GuardTableBuilder();
    }

    public GuardTableBuilder guard(final String guard, final Predicate<Object> predicate) {
      if (guard == null || predicate == null) {
        throw new IllegalArgumentException("Guard text and predicate cannot be null");
      }
      predicates.put(guard.trim(), predicate);
      return this;
    }

    /**
     * Guard that ignores the payload and always yields the given value.
     */
    public GuardTableBuilder constant(final String guard, final boolean value) {
      return guard(guard, payload -> value);
    }

    public GuardTable build() {
      return new GuardTable(predicates);
    }

    private GuardTableBuilder() {}
  }
}
