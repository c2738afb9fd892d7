package com.recordsearch.embeddings.service.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetField {

  private String name;

  private FieldType type;

  /** Set by the dataset owner to opt a text or editor field into embeddings. */
  private boolean embeddable;

  public boolean canEmbed() {
    return embeddable && type != null && type.supportsEmbedding();
  }
}
