package com.recordsearch.embeddings.service;

import com.recordsearch.embeddings.dto.EmbeddingMode;
import com.recordsearch.embeddings.service.storage.Dataset;
import com.recordsearch.embeddings.service.storage.DatasetField;

import lombok.Value;

/** The resolved dataset and field an embedding operation works on. */
@Value
public class EmbeddingTarget {

  Dataset dataset;

  EmbeddingMode mode;

  /** Field name used as the storage and cache key; {@code _record} in record mode. */
  String fieldName;

  /** Schema of the field in field mode; null in record mode. */
  DatasetField field;

  public String getDatasetId() {
    return dataset.getId();
  }
}
