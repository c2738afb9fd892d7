package com.recordsearch.embeddings.exception;

/** Thrown when a stored embedding cannot be turned into a float vector. */
public class VectorDecodeException extends RuntimeException {

  public VectorDecodeException(String message) {
    super(message);
  }

  public VectorDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
