package com.recordsearch.embeddings.dto;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Whether embeddings are computed from one field or from the whole record. */
public enum EmbeddingMode {
  FIELD("field"),
  RECORD("record");

  /** Field name under which record-level embeddings are stored and cached. */
  public static final String RECORD_FIELD_NAME = "_record";

  private final String value;

  EmbeddingMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Parse a mode name. A null or blank value means field mode.
   *
   * @throws IllegalArgumentException for any other unknown value
   */
  @JsonCreator
  public static EmbeddingMode fromValue(String value) {
    if (value == null || value.isBlank()) {
      return FIELD;
    }
    return Arrays.stream(values())
        .filter(mode -> mode.value.equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "invalid embedding mode: " + value + " (must be 'field' or 'record')"));
  }

  public static EmbeddingMode orDefault(EmbeddingMode mode) {
    return mode == null ? FIELD : mode;
  }
}
