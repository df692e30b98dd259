package com.github.fsmdsl.codegen;

import com.github.fsmdsl.FsmException;

/**
 * Code generation failure. {@link #getSubject()} names the requested target for
 * {@link Code#UNKNOWN_TARGET} and the offending identifier for {@link Code#UNRENDERABLE_CONSTRUCT}.
 */
public final class CodegenException extends FsmException {
  private static final long serialVersionUID = 1L;
  private final String subject;

  public CodegenException(final Code code, final String subject, final String message) {
    super(code, message);
    this.subject = subject;
  }

  public CodegenException(final Code code, final Throwable throwable) {
    super(code, throwable);
    this.subject = null;
  }

  public String getSubject() {
    return subject;
  }
}
