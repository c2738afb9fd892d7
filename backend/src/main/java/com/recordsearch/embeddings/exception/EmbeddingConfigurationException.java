package com.recordsearch.embeddings.exception;

/**
 * Embedding features cannot run with the current configuration: disabled, or missing an API key or
 * model.
 */
public class EmbeddingConfigurationException extends RuntimeException {

  public EmbeddingConfigurationException(String message) {
    super(message);
  }
}
