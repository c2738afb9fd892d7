package com.recordsearch.embeddings.service.storage;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FieldType {
  TEXT("text"),
  EDITOR("editor"),
  EMAIL("email"),
  URL("url"),
  NUMBER("number"),
  BOOL("bool"),
  DATE("date"),
  SELECT("select"),
  JSON("json");

  private final String value;

  FieldType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static FieldType fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown field type: " + value));
  }

  /** Text and editor fields are the only ones that can be embedded on their own. */
  public boolean supportsEmbedding() {
    return this == TEXT || this == EDITOR;
  }

  /** Fields included in the default whole-record text. */
  public boolean isTextual() {
    return this == TEXT || this == EDITOR || this == EMAIL || this == URL;
  }
}
