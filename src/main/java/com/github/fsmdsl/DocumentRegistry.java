package com.github.fsmdsl;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmdsl.model.FsmDefinition;
import com.github.fsmdsl.model.ValidationResult;
import com.github.fsmdsl.parse.DslSyntaxException;

/**
 * Owns the current definition of every open document. Editors push source text in, the renderer
 * and simulator look definitions up by document id. An entry is replaced only by a fully valid
 * parse, so a half-typed document keeps its last good model.
 */
public final class DocumentRegistry {
  private static final Logger logger = LogManager.getLogger(DocumentRegistry.class.getSimpleName());

  private final FsmPipeline pipeline;
  private final ConcurrentMap<String, FsmDefinition> documents = new ConcurrentHashMap<>();

  public DocumentRegistry() {
    this(new FsmPipeline());
  }

  public DocumentRegistry(final FsmPipeline pipeline) {
    this.pipeline = pipeline;
  }

  /**
   * Compiles the source and, when it is valid, makes it the document's definition.
   *
   * @return the validation outcome, whether or not the entry was replaced
   * @throws DslSyntaxException when the source does not parse; the entry is left untouched
   */
  public ValidationResult load(final String documentId, final String source)
      throws DslSyntaxException {
    if (documentId == null || documentId.isEmpty()) {
      throw new IllegalArgumentException("Document id cannot be null or empty");
    }
    final ValidationResult result = pipeline.compile(source);
    if (result.isValid()) {
      final FsmDefinition previous = documents.put(documentId, result.getDefinition());
      logger.info((previous == null ? "Registered" : "Replaced") + " document " + documentId
          + " as fsm " + result.getDefinition().getName());
    } else {
      logger.info("Kept previous model of document " + documentId + ", new source has "
          + result.getErrors().size() + " error(s)");
    }
    return result;
  }

  public FsmDefinition lookup(final String documentId) {
    return documents.get(documentId);
  }

  public boolean unregister(final String documentId) {
    final boolean removed = documents.remove(documentId) != null;
    if (removed) {
      logger.info("Unregistered document " + documentId);
    }
    return removed;
  }

  public Set<String> documentIds() {
    return Collections.unmodifiableSet(new TreeSet<>(documents.keySet()));
  }
}
