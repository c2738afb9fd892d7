package com.recordsearch.embeddings.service.storage;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetRecord {

  private String id;

  private String datasetId;

  @Builder.Default private Map<String, Object> values = new LinkedHashMap<>();

  /** The value of a field as text, empty when the field is unset. */
  public String getString(String fieldName) {
    Object value = values == null ? null : values.get(fieldName);
    return value == null ? "" : value.toString();
  }
}
