package com.recordsearch.embeddings.exception;

/** A dataset, field or stored embedding referenced by a request does not exist. */
public class ResourceNotFoundException extends RuntimeException {

  public ResourceNotFoundException(String message) {
    super(message);
  }
}
