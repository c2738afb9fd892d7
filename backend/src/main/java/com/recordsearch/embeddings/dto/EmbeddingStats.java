package com.recordsearch.embeddings.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingStats {

  private int totalRecords;

  private int embeddedRecords;

  private int notEmbeddedRecords;
}
