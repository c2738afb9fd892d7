package com.recordsearch.embeddings.service.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A named collection of records and the schema of their fields. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dataset {

  private String id;

  private String name;

  @Builder.Default private List<DatasetField> fields = new ArrayList<>();

  public Optional<DatasetField> findField(String fieldName) {
    if (fieldName == null || fields == null) {
      return Optional.empty();
    }
    return fields.stream().filter(f -> fieldName.equals(f.getName())).findFirst();
  }
}
