package com.recordsearch.embeddings.service.provider;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.recordsearch.embeddings.config.ApplicationProperties;
import com.recordsearch.embeddings.exception.EmbeddingConfigurationException;
import com.recordsearch.embeddings.exception.EmbeddingProviderException;

import lombok.extern.slf4j.Slf4j;

/**
 * Calls the OpenAI embeddings endpoint. The whole batch goes out in one request; the response
 * carries a positional index per vector, which is used to restore input order.
 */
@Slf4j
@Service
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

  public static final String NAME = "openai";

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;
  private final RestTemplate queryRestTemplate;
  private final ApplicationProperties.Ai settings;

  public OpenAiEmbeddingProvider(
      ObjectMapper objectMapper,
      @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
      @Qualifier("embeddingQueryRestTemplate") RestTemplate queryRestTemplate,
      ApplicationProperties properties) {
    this.objectMapper = objectMapper;
    this.restTemplate = restTemplate;
    this.queryRestTemplate = queryRestTemplate;
    this.settings = properties.getAi();
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public String getModelId() {
    return settings.getEmbeddingModel();
  }

  @Override
  public void validateConfiguration() {
    if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
      throw new EmbeddingConfigurationException("AI API key is not configured");
    }
    if (settings.getEmbeddingModel() == null || settings.getEmbeddingModel().isBlank()) {
      throw new EmbeddingConfigurationException("embedding model is not configured");
    }
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    return call(restTemplate, texts);
  }

  @Override
  public float[] embedQuery(String text) {
    List<float[]> embeddings = call(queryRestTemplate, List.of(text));
    if (embeddings.isEmpty()) {
      throw new EmbeddingProviderException("no embedding returned for query text");
    }
    return embeddings.get(0);
  }

  private List<float[]> call(RestTemplate template, List<String> texts) {
    ObjectNode requestBody = objectMapper.createObjectNode();
    requestBody.put("model", settings.getEmbeddingModel());
    ArrayNode input = requestBody.putArray("input");
    texts.forEach(input::add);
    requestBody.put("encoding_format", "float");
    if (settings.getEmbeddingDimensions() > 0) {
      requestBody.put("dimensions", settings.getEmbeddingDimensions());
    }

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setBearerAuth(settings.getApiKey());
    HttpEntity<String> entity = new HttpEntity<>(requestBody.toString(), headers);

    log.debug(
        "OpenAI embeddings request model={}, texts={}", settings.getEmbeddingModel(), texts.size());

    ResponseEntity<String> response;
    try {
      response = template.exchange(endpoint(), HttpMethod.POST, entity, String.class);
    } catch (RestClientResponseException e) {
      throw new EmbeddingProviderException(
          String.format(
              "OpenAI API error (status %d): %s",
              e.getStatusCode().value(), e.getResponseBodyAsString()),
          e);
    } catch (RestClientException e) {
      throw new EmbeddingProviderException("failed to call OpenAI API: " + e.getMessage(), e);
    }

    if (response.getBody() == null) {
      throw new EmbeddingProviderException(
          "empty response from OpenAI API (status " + response.getStatusCode().value() + ")");
    }
    return parse(response.getBody());
  }

  private List<float[]> parse(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException e) {
      throw new EmbeddingProviderException("failed to parse response: " + e.getMessage(), e);
    }

    JsonNode data = root.get("data");
    if (data == null || !data.isArray()) {
      throw new EmbeddingProviderException("invalid response format from OpenAI API");
    }

    List<JsonNode> items = new ArrayList<>(data.size());
    data.forEach(items::add);
    items.sort(Comparator.comparingInt(item -> item.path("index").asInt()));

    List<float[]> embeddings = new ArrayList<>(items.size());
    for (JsonNode item : items) {
      JsonNode embedding = item.get("embedding");
      if (embedding == null || !embedding.isArray()) {
        throw new EmbeddingProviderException("response item has no embedding array");
      }
      float[] vector = new float[embedding.size()];
      for (int i = 0; i < vector.length; i++) {
        vector[i] = embedding.get(i).floatValue();
      }
      embeddings.add(vector);
    }
    return embeddings;
  }

  private String endpoint() {
    String baseUrl = settings.getBaseUrl();
    if (baseUrl.endsWith("/")) {
      baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
    return baseUrl + "/embeddings";
  }
}
