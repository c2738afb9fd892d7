package com.recordsearch.embeddings.service.provider;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.recordsearch.embeddings.config.ApplicationProperties;
import com.recordsearch.embeddings.exception.EmbeddingConfigurationException;
import com.recordsearch.embeddings.exception.EmbeddingProviderException;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

/**
 * Generates embeddings with Amazon Titan Text Embeddings on AWS Bedrock. Titan takes one input text
 * per invocation, so batches are embedded text by text.
 */
@Slf4j
@Service
public class BedrockEmbeddingProvider implements EmbeddingProvider {

  public static final String NAME = "bedrock";

  private final ObjectMapper objectMapper;
  private final ApplicationProperties.Ai settings;
  private final AwsCredentialsProvider credentialsProvider;
  private volatile BedrockRuntimeClient bedrockClient;

  @Autowired
  public BedrockEmbeddingProvider(ObjectMapper objectMapper, ApplicationProperties properties) {
    this(objectMapper, properties, DefaultCredentialsProvider.create(), null);
  }

  /** A null client is built lazily from the region and credentials on first use. */
  BedrockEmbeddingProvider(
      ObjectMapper objectMapper,
      ApplicationProperties properties,
      AwsCredentialsProvider credentialsProvider,
      BedrockRuntimeClient bedrockClient) {
    this.objectMapper = objectMapper;
    this.settings = properties.getAi();
    this.credentialsProvider = credentialsProvider;
    this.bedrockClient = bedrockClient;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public String getModelId() {
    return settings.getBedrock().getModelId();
  }

  @Override
  public void validateConfiguration() {
    ApplicationProperties.Bedrock bedrock = settings.getBedrock();
    if (bedrock.getModelId() == null || bedrock.getModelId().isBlank()) {
      throw new EmbeddingConfigurationException("embedding model is not configured");
    }
    if (bedrock.getRegion() == null || bedrock.getRegion().isBlank()) {
      throw new EmbeddingConfigurationException("AWS region is not configured");
    }
    if (bedrockClient != null) {
      return;
    }
    try {
      credentialsProvider.resolveCredentials();
    } catch (SdkException e) {
      log.debug("AWS credentials not available: {}", e.getMessage());
      throw new EmbeddingConfigurationException("AWS credentials are not configured");
    }
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    log.debug("Generating Titan embeddings for {} texts", texts.size());
    List<float[]> embeddings = new ArrayList<>(texts.size());
    for (String text : texts) {
      embeddings.add(invoke(text, settings.getGenerationTimeout()));
    }
    return embeddings;
  }

  @Override
  public float[] embedQuery(String text) {
    return invoke(text, settings.getQueryTimeout());
  }

  @PreDestroy
  public void close() {
    if (bedrockClient != null) {
      bedrockClient.close();
    }
  }

  private float[] invoke(String text, Duration timeout) {
    try {
      ObjectNode requestBody = objectMapper.createObjectNode();
      requestBody.put("inputText", text);
      if (settings.getEmbeddingDimensions() > 0) {
        requestBody.put("dimensions", settings.getEmbeddingDimensions());
      }

      InvokeModelRequest request =
          InvokeModelRequest.builder()
              .modelId(getModelId())
              .contentType("application/json")
              .accept("application/json")
              .body(SdkBytes.fromString(requestBody.toString(), StandardCharsets.UTF_8))
              .overrideConfiguration(
                  AwsRequestOverrideConfiguration.builder().apiCallTimeout(timeout).build())
              .build();

      InvokeModelResponse response = client().invokeModel(request);
      JsonNode embedding = objectMapper.readTree(response.body().asUtf8String()).get("embedding");
      if (embedding == null || !embedding.isArray()) {
        throw new EmbeddingProviderException("Titan response has no embedding array");
      }

      float[] vector = new float[embedding.size()];
      for (int i = 0; i < vector.length; i++) {
        vector[i] = embedding.get(i).floatValue();
      }
      return vector;
    } catch (EmbeddingProviderException e) {
      throw e;
    } catch (Exception e) {
      log.error("Error generating Titan embedding", e);
      throw new EmbeddingProviderException("Bedrock embedding call failed: " + e.getMessage(), e);
    }
  }

  private BedrockRuntimeClient client() {
    BedrockRuntimeClient client = bedrockClient;
    if (client == null) {
      synchronized (this) {
        client = bedrockClient;
        if (client == null) {
          client =
              BedrockRuntimeClient.builder()
                  .region(Region.of(settings.getBedrock().getRegion()))
                  .credentialsProvider(credentialsProvider)
                  .build();
          bedrockClient = client;
          log.info("Bedrock client initialized for embeddings");
        }
      }
    }
    return client;
  }
}
