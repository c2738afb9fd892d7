package com.recordsearch.embeddings.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FindSimilarResponse {

  private List<SimilarRecord> results;

  private SimilarityDebug debug;
}
