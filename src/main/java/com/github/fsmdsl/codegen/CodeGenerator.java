package com.github.fsmdsl.codegen;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmdsl.model.FsmDefinition;

/**
 * Turns a validated definition into source text for a named target. Generation is pure: the same
 * definition, target and options always yield the same text.
 */
public final class CodeGenerator {
  private static final Logger logger = LogManager.getLogger(CodeGenerator.class.getSimpleName());

  private final StandardJavaEmitter standardEmitter;

  public CodeGenerator() throws CodegenException {
    this.standardEmitter =
        new StandardJavaEmitter(SourceTemplate.load(StandardJavaEmitter.TEMPLATE));
  }

  public String generate(final FsmDefinition definition, final String target)
      throws CodegenException {
    return generate(definition, target, GeneratorOptions.defaults());
  }

  /**
   * @throws CodegenException with {@code UNKNOWN_TARGET} for a target outside {@link TargetKind},
   *         {@code UNRENDERABLE_CONSTRUCT} for identifiers the target language reserves
   */
  public String generate(final FsmDefinition definition, final String target,
      final GeneratorOptions options) throws CodegenException {
    if (definition == null || options == null) {
      throw new IllegalArgumentException("Definition and options cannot be null");
    }
    final TargetKind kind = TargetKind.fromName(target);
    final DispatchTable table = DispatchTable.of(definition);
    final String source;
    switch (kind) {
      case STANDARD:
        source = standardEmitter.emit(table, options);
        break;
      default:
        throw new IllegalStateException("Unhandled target " + kind);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Generated " + source.length() + " chars of " + kind.getTargetName()
          + " source for " + table);
    }
    return source;
  }

  /**
   * Simple name of the class {@link #generate} emits for the definition.
   */
  public static String className(final FsmDefinition definition, final GeneratorOptions options)
      throws CodegenException {
    return StandardJavaEmitter.className(DispatchTable.of(definition), options);
  }
}
