package com.recordsearch.embeddings.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to find records similar to a text or to an already embedded record")
public class FindSimilarRequest {

  @NotBlank(message = "datasetId is required")
  @Schema(description = "Dataset name or id")
  private String datasetId;

  @Schema(description = "Field to search in field mode")
  private String fieldName;

  @Schema(description = "'field' (default) or 'record'")
  private EmbeddingMode mode;

  @Schema(description = "Free text to embed and search with")
  private String text;

  @Schema(description = "Id of a record whose stored embedding is used as the query")
  private String recordId;

  @Min(value = 0, message = "limit must be between 0 and 100")
  @Max(value = 100, message = "limit must be between 0 and 100")
  @Schema(description = "Maximum number of results, 10 when omitted")
  private Integer limit;
}
