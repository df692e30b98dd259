package com.github.fsmdsl.runtime;

/**
 * Everything a generated machine needs from the application embedding it.
 */
public interface MachineHost extends GuardEvaluator, ActionHandler {
}
