package com.recordsearch.embeddings.service;

import org.springframework.stereotype.Service;

import com.recordsearch.embeddings.config.ApplicationProperties;
import com.recordsearch.embeddings.dto.EmbeddingMode;
import com.recordsearch.embeddings.exception.EmbeddingConfigurationException;
import com.recordsearch.embeddings.exception.ResourceNotFoundException;
import com.recordsearch.embeddings.service.provider.EmbeddingProvider;
import com.recordsearch.embeddings.service.provider.EmbeddingProviderSelector;
import com.recordsearch.embeddings.service.storage.Dataset;
import com.recordsearch.embeddings.service.storage.DatasetField;
import com.recordsearch.embeddings.service.storage.DatasetRepository;

import lombok.RequiredArgsConstructor;

/**
 * Validates configuration and resolves the dataset and field of an embedding request. Every check
 * here runs before any cache or network work.
 */
@Service
@RequiredArgsConstructor
public class EmbeddingTargetResolver {

  private final ApplicationProperties properties;
  private final DatasetRepository datasetRepository;
  private final EmbeddingProviderSelector providerSelector;

  public void requireEnabled() {
    if (!properties.getAi().isEnabled()) {
      throw new EmbeddingConfigurationException("AI features are not enabled");
    }
  }

  /**
   * Gets a ready-to-use embedding provider.
   *
   * @throws EmbeddingConfigurationException if disabled or no provider is configured
   */
  public EmbeddingProvider requireProvider() {
    requireEnabled();
    return providerSelector.getProvider();
  }

  public Dataset requireDataset(String nameOrId) {
    return datasetRepository
        .findByNameOrId(nameOrId)
        .orElseThrow(() -> new ResourceNotFoundException("dataset not found: " + nameOrId));
  }

  /**
   * Resolve the dataset and field of a request.
   *
   * @param datasetNameOrId dataset name or id
   * @param mode field or record mode; null means field mode
   * @param fieldName field name, required in field mode
   * @param requireEmbeddable whether the field must be marked embeddable
   */
  public EmbeddingTarget resolve(
      String datasetNameOrId, EmbeddingMode mode, String fieldName, boolean requireEmbeddable) {
    EmbeddingMode effectiveMode = EmbeddingMode.orDefault(mode);
    Dataset dataset = requireDataset(datasetNameOrId);

    if (effectiveMode == EmbeddingMode.RECORD) {
      return new EmbeddingTarget(dataset, effectiveMode, EmbeddingMode.RECORD_FIELD_NAME, null);
    }

    if (fieldName == null || fieldName.isBlank()) {
      throw new IllegalArgumentException("fieldName is required for field-level mode");
    }
    DatasetField field =
        dataset
            .findField(fieldName)
            .orElseThrow(
                () ->
                    new ResourceNotFoundException(
                        String.format("field '%s' not found in dataset", fieldName)));
    if (requireEmbeddable && !field.canEmbed()) {
      throw new IllegalArgumentException(
          String.format(
              "field '%s' is not a text/editor field or is not marked as embeddable", fieldName));
    }
    return new EmbeddingTarget(dataset, effectiveMode, fieldName, field);
  }
}
