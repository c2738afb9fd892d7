package com.recordsearch.embeddings.service.provider;

import java.util.List;

import com.recordsearch.embeddings.exception.EmbeddingConfigurationException;

/** Client for an external text embedding API. */
public interface EmbeddingProvider {

  /** Short provider name used in configuration, e.g. {@code openai}. */
  String getName();

  /** Model identifier recorded alongside stored vectors. */
  String getModelId();

  /**
   * Checks that the provider has everything it needs to make calls.
   *
   * @throws EmbeddingConfigurationException describing the first missing setting
   */
  void validateConfiguration();

  default boolean isConfigured() {
    try {
      validateConfiguration();
      return true;
    } catch (EmbeddingConfigurationException e) {
      return false;
    }
  }

  /**
   * Embeds a batch of texts. Blocks for up to the generation timeout.
   *
   * @param texts texts to embed
   * @return one vector per text, in input order
   * @throws com.recordsearch.embeddings.exception.EmbeddingProviderException on any upstream
   *     failure
   */
  List<float[]> embed(List<String> texts);

  /**
   * Embeds a single search query. Blocks for up to the shorter query timeout.
   *
   * @throws com.recordsearch.embeddings.exception.EmbeddingProviderException on any upstream
   *     failure or when no vector is returned
   */
  float[] embedQuery(String text);
}
