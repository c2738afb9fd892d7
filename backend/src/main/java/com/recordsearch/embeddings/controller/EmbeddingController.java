package com.recordsearch.embeddings.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.recordsearch.embeddings.dto.EmbeddableField;
import com.recordsearch.embeddings.dto.EmbeddingStats;
import com.recordsearch.embeddings.dto.FindSimilarRequest;
import com.recordsearch.embeddings.dto.FindSimilarResponse;
import com.recordsearch.embeddings.dto.GenerateEmbeddingsRequest;
import com.recordsearch.embeddings.dto.GenerateEmbeddingsResponse;
import com.recordsearch.embeddings.service.EmbeddingGenerationService;
import com.recordsearch.embeddings.service.EmbeddingMaintenanceService;
import com.recordsearch.embeddings.service.SimilaritySearchService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/embeddings")
@RequiredArgsConstructor
@Tag(name = "Embeddings", description = "Generate record embeddings and search by similarity")
public class EmbeddingController {

  private final EmbeddingGenerationService generationService;
  private final SimilaritySearchService searchService;
  private final EmbeddingMaintenanceService maintenanceService;

  @PostMapping("/generate")
  @Operation(
      summary = "Generate embeddings",
      description =
          "Embeds one field of each record (field mode) or the whole record (record mode) and stores"
              + " the vectors. Batch failures are reported in the response.",
      responses = {
        @ApiResponse(
            responseCode = "200",
            description = "Generation finished",
            content =
                @Content(schema = @Schema(implementation = GenerateEmbeddingsResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid mode or field"),
        @ApiResponse(responseCode = "404", description = "Dataset or field not found"),
        @ApiResponse(responseCode = "412", description = "AI features not configured")
      })
  public ResponseEntity<GenerateEmbeddingsResponse> generate(
      @Valid @RequestBody GenerateEmbeddingsRequest request) {
    log.info(
        "Embedding generation requested for dataset {} field {} mode {}",
        request.getDatasetId(),
        request.getFieldName(),
        request.getMode());
    return ResponseEntity.ok(generationService.generate(request));
  }

  @PostMapping("/find-similar")
  @Operation(
      summary = "Find similar records",
      description = "Ranks stored embeddings by cosine similarity to a text or a record",
      responses = {
        @ApiResponse(
            responseCode = "200",
            description = "Ranked results",
            content = @Content(schema = @Schema(implementation = FindSimilarResponse.class))),
        @ApiResponse(responseCode = "400", description = "Missing query or invalid request"),
        @ApiResponse(responseCode = "404", description = "Dataset, field or record not found"),
        @ApiResponse(responseCode = "412", description = "AI features not configured"),
        @ApiResponse(responseCode = "502", description = "Embedding provider call failed")
      })
  public ResponseEntity<FindSimilarResponse> findSimilar(
      @Valid @RequestBody FindSimilarRequest request) {
    return ResponseEntity.ok(searchService.findSimilar(request));
  }

  @GetMapping("/stats")
  @Operation(summary = "Embedding coverage of a dataset field")
  public ResponseEntity<EmbeddingStats> getStats(
      @Parameter(description = "Dataset name or id", required = true) @RequestParam
          String datasetId,
      @Parameter(description = "Field name, or _record for record embeddings", required = true)
          @RequestParam
          String fieldName) {
    return ResponseEntity.ok(maintenanceService.stats(datasetId, fieldName));
  }

  @GetMapping("/pending")
  @Operation(summary = "Ids of records not embedded yet for a field")
  public ResponseEntity<List<String>> getPending(
      @RequestParam String datasetId, @RequestParam String fieldName) {
    return ResponseEntity.ok(maintenanceService.pendingRecordIds(datasetId, fieldName));
  }

  @GetMapping("/fields")
  @Operation(summary = "Fields of a dataset that can be embedded")
  public ResponseEntity<List<EmbeddableField>> getEmbeddableFields(
      @RequestParam String datasetId) {
    return ResponseEntity.ok(maintenanceService.embeddableFields(datasetId));
  }

  @DeleteMapping("/records/{recordId}")
  @Operation(summary = "Delete all embeddings of a record")
  public ResponseEntity<Void> deleteRecordEmbeddings(@PathVariable String recordId) {
    maintenanceService.deleteForRecord(recordId);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/datasets/{datasetId}")
  @Operation(
      summary = "Delete embeddings of a dataset",
      description = "Deletes one field's embeddings when fieldName is given, otherwise all of them")
  public ResponseEntity<Void> deleteDatasetEmbeddings(
      @PathVariable String datasetId, @RequestParam(required = false) String fieldName) {
    if (fieldName == null || fieldName.isBlank()) {
      maintenanceService.deleteForDataset(datasetId);
    } else {
      maintenanceService.deleteForField(datasetId, fieldName);
    }
    return ResponseEntity.noContent().build();
  }
}
