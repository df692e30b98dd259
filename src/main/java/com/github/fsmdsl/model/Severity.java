package com.github.fsmdsl.model;

/**
 * Errors block simulation and code generation, warnings do not.
 */
public enum Severity {
  ERROR,
  WARNING;
}
