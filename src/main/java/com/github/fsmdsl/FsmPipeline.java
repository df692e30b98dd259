package com.github.fsmdsl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmdsl.FsmException.Code;
import com.github.fsmdsl.model.Diagnostic;
import com.github.fsmdsl.model.FsmDefinition;
import com.github.fsmdsl.model.FsmDraft;
import com.github.fsmdsl.model.SemanticValidator;
import com.github.fsmdsl.model.ValidationResult;
import com.github.fsmdsl.parse.AstBuilder;
import com.github.fsmdsl.parse.DslParser;
import com.github.fsmdsl.parse.DslSyntaxException;

/**
 * DSL text in, validated model out: parser, AST builder and validator chained together. Stateless
 * and safe to share between threads.
 */
public final class FsmPipeline {
  private static final Logger logger = LogManager.getLogger(FsmPipeline.class.getSimpleName());

  private final DslParser parser = new DslParser();
  private final AstBuilder builder = new AstBuilder();
  private final SemanticValidator validator = new SemanticValidator();

  /**
   * Parses and builds the draft without validating it.
   */
  public FsmDraft parse(final String source) throws DslSyntaxException {
    return builder.build(parser.parse(source));
  }

  /**
   * Parses and validates. Syntax errors are thrown; semantic problems come back as diagnostics.
   */
  public ValidationResult compile(final String source) throws DslSyntaxException {
    final ValidationResult result = validator.validate(parse(source));
    if (logger.isDebugEnabled()) {
      logger.debug("Compiled " + result);
    }
    return result;
  }

  /**
   * Like {@link #compile} but insists on a valid definition.
   *
   * @throws FsmException with {@link Code#VALIDATION_FAILURE} and the error diagnostics attached
   */
  public FsmDefinition compileOrThrow(final String source) throws FsmException {
    final ValidationResult result = compile(source);
    if (!result.isValid()) {
      final StringBuilder message = new StringBuilder("Model has ")
          .append(result.getErrors().size()).append(" error(s)");
      for (final Diagnostic error : result.getErrors()) {
        message.append("\n  ").append(error.format());
      }
      throw new FsmException(Code.VALIDATION_FAILURE, message.toString(), result.getErrors());
    }
    return result.getDefinition();
  }
}
