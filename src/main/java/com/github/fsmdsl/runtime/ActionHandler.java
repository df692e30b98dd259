package com.github.fsmdsl.runtime;

/**
 * Receives every executed action, timer built-ins included, in execution order.
 */
@FunctionalInterface
public interface ActionHandler {

  ActionHandler NO_OP = new ActionHandler() {
    @Override
    public void execute(final String action, final Object payload) {}
  };

  void execute(String action, Object payload) throws Exception;
}
