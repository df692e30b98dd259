package com.github.fsmdsl.codegen;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.github.fsmdsl.FsmException.Code;

/**
 * Classpath text template with {@code ${name}} placeholders. Substituted values are inserted
 * verbatim and never rescanned.
 */
final class SourceTemplate {
  private final String resource;
  private final String text;

  private SourceTemplate(final String resource, final String text) {
    this.resource = resource;
    this.text = text;
  }

  static SourceTemplate load(final String resource) throws CodegenException {
    try (InputStream stream = SourceTemplate.class.getResourceAsStream(resource)) {
      if (stream == null) {
        throw new CodegenException(Code.IO_FAILURE, resource,
            "Template " + resource + " not found on the classpath");
      }
      return new SourceTemplate(resource, new String(stream.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException problem) {
      throw new CodegenException(Code.IO_FAILURE, problem);
    }
  }

  /**
   * @throws IllegalArgumentException when the template names a placeholder missing from values
   */
  String render(final Map<String, String> values) {
    final StringBuilder out = new StringBuilder(text.length() * 2);
    int from = 0;
    int open;
    while ((open = text.indexOf("${", from)) >= 0) {
      final int close = text.indexOf('}', open + 2);
      if (close < 0) {
        break;
      }
      final String name = text.substring(open + 2, close);
      final String value = values.get(name);
      if (value == null) {
        throw new IllegalArgumentException(
            "No value for placeholder " + name + " in template " + resource);
      }
      out.append(text, from, open).append(value);
      from = close + 1;
    }
    return out.append(text, from, text.length()).toString();
  }

  @Override
  public String toString() {
    return "SourceTemplate [resource=" + resource + "]";
  }
}
