package com.recordsearch.embeddings.exception;

/** The external embedding API failed, timed out or returned something unusable. */
public class EmbeddingProviderException extends RuntimeException {

  public EmbeddingProviderException(String message) {
    super(message);
  }

  public EmbeddingProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
