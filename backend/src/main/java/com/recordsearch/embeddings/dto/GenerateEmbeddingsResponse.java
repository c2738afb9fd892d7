package com.recordsearch.embeddings.dto;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateEmbeddingsResponse {

  private int generated;

  private int skipped;

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  @Builder.Default
  private List<String> errors = new ArrayList<>();
}
