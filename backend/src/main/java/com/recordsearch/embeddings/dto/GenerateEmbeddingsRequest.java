package com.recordsearch.embeddings.dto;

import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to generate and store embeddings for the records of a dataset")
public class GenerateEmbeddingsRequest {

  @NotBlank(message = "datasetId is required")
  @Schema(description = "Dataset name or id")
  private String datasetId;

  @Schema(description = "Embeddable field to embed in field mode")
  private String fieldName;

  @Schema(description = "'field' (default) or 'record'")
  private EmbeddingMode mode;

  @Schema(description = "Records to embed (optional; all records when empty)")
  private List<String> recordIds;

  @Schema(description = "Record mode template with {fieldName} placeholders (optional)")
  private String template;
}
