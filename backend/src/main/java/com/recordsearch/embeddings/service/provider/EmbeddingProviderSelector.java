package com.recordsearch.embeddings.service.provider;

import org.springframework.stereotype.Service;

import com.recordsearch.embeddings.config.ApplicationProperties;
import com.recordsearch.embeddings.exception.EmbeddingConfigurationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses the embedding provider named in configuration. There is no fallback to another provider:
 * vectors from different models are not comparable, so a misconfigured provider fails the request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingProviderSelector {

  private final OpenAiEmbeddingProvider openAiProvider;
  private final BedrockEmbeddingProvider bedrockProvider;
  private final ApplicationProperties properties;

  /**
   * Gets the provider to use for the next call.
   *
   * @return the configured provider
   * @throws EmbeddingConfigurationException if the selected provider is not configured
   */
  public EmbeddingProvider getProvider() {
    String preferred = properties.getAi().getProvider();
    EmbeddingProvider provider =
        BedrockEmbeddingProvider.NAME.equalsIgnoreCase(preferred) ? bedrockProvider : openAiProvider;
    provider.validateConfiguration();
    log.debug(
        "Using embedding provider '{}' with model {}", provider.getName(), provider.getModelId());
    return provider;
  }
}
