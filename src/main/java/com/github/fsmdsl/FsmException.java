package com.github.fsmdsl;

import java.util.Collections;
import java.util.List;

import com.github.fsmdsl.model.Diagnostic;

/**
 * Unified exception family thrown by the DSL pipeline, the simulator and the code generator. The
 * idea is to use the code enum to encapsulate the various error conditions; subclasses exist only
 * where a failure carries extra context (source position, requested target...). Stack traces,
 * where available, are not meant to be kept from users.
 */
public class FsmException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final List<Diagnostic> diagnostics;

  public FsmException(final Code code) {
    super(code.getDescription());
    this.code = code;
    this.diagnostics = Collections.emptyList();
  }

  public FsmException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.diagnostics = Collections.emptyList();
  }

  public FsmException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
    this.diagnostics = Collections.emptyList();
  }

  public FsmException(final Code code, final String message, final List<Diagnostic> diagnostics) {
    super(message);
    this.code = code;
    this.diagnostics = Collections.unmodifiableList(diagnostics);
  }

  public Code getCode() {
    return code;
  }

  /**
   * Diagnostics attached to a {@link Code#VALIDATION_FAILURE}, empty otherwise.
   */
  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public static enum Code {
    // 1.
    SYNTAX_ERROR("DSL source text does not match the grammar"),
    // 2.
    VALIDATION_FAILURE("Model failed semantic validation. Check the attached diagnostics."),
    // 3.
    UNKNOWN_TARGET("Requested code generation target is not supported"),
    // 4.
    UNRENDERABLE_CONSTRUCT("Model contains a construct the selected target cannot render"),
    // 5.
    MACHINE_NOT_LOADED("Simulator has no machine loaded and cannot service requests"),
    // 6.
    CHAIN_LIMIT_EXCEEDED(
        "Choice or completion chain exceeded the configured limit, the model contains a cycle"),
    // 7.
    LOCK_ACQUISITION_FAILURE(
        "Failed to acquire read or write lock to perform requested operation. This is retryable."),
    // 8.
    INVALID_CONFIG("Configuration is invalid"),
    // 9.
    INTERRUPTED("Operation was interrupted"),
    // 10.
    IO_FAILURE("Failed to read or write an external resource");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
