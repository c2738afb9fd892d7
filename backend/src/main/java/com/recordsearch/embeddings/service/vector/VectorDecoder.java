package com.recordsearch.embeddings.service.vector;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recordsearch.embeddings.exception.VectorDecodeException;

import lombok.RequiredArgsConstructor;

/**
 * Turns a stored embedding into a {@code float[]}. Stores hand vectors back in whatever shape they
 * were persisted in: typed arrays, raw JSON (string or bytes), a parsed JSON tree or a list of
 * mixed numbers. Anything else fails for that one record only. The result is always a new array.
 */
@Component
@RequiredArgsConstructor
public class VectorDecoder {

  private static final int PREVIEW_LENGTH = 100;

  private final ObjectMapper objectMapper;

  public float[] decode(Object raw) {
    if (raw == null) {
      throw new VectorDecodeException("embedding field is null");
    }
    if (raw instanceof float[]) {
      return ((float[]) raw).clone();
    }
    if (raw instanceof double[]) {
      double[] values = (double[]) raw;
      float[] result = new float[values.length];
      for (int i = 0; i < values.length; i++) {
        result[i] = (float) values[i];
      }
      return result;
    }
    if (raw instanceof List<?>) {
      return fromList((List<?>) raw);
    }
    if (raw instanceof JsonNode) {
      return fromJsonNode((JsonNode) raw);
    }
    if (raw instanceof String) {
      return fromJson((String) raw);
    }
    if (raw instanceof byte[]) {
      return fromJson(new String((byte[]) raw, StandardCharsets.UTF_8));
    }

    String preview = String.valueOf(raw);
    if (preview.length() > PREVIEW_LENGTH) {
      preview = preview.substring(0, PREVIEW_LENGTH);
    }
    throw new VectorDecodeException(
        String.format(
            "unexpected embedding type: %s, value preview: %s",
            raw.getClass().getSimpleName(), preview));
  }

  private float[] fromList(List<?> values) {
    float[] result = new float[values.size()];
    for (int i = 0; i < values.size(); i++) {
      Object value = values.get(i);
      if (!(value instanceof Number)) {
        throw new VectorDecodeException(
            String.format(
                "unexpected type in embedding array at index %d: %s",
                i, value == null ? "null" : value.getClass().getSimpleName()));
      }
      result[i] = ((Number) value).floatValue();
    }
    return result;
  }

  private float[] fromJson(String json) {
    try {
      return fromJsonNode(objectMapper.readTree(json));
    } catch (IOException e) {
      throw new VectorDecodeException("failed to parse embedding JSON: " + e.getMessage(), e);
    }
  }

  private float[] fromJsonNode(JsonNode node) {
    if (node == null || !node.isArray()) {
      throw new VectorDecodeException(
          "embedding JSON is not an array: " + (node == null ? "null" : node.getNodeType()));
    }
    float[] result = new float[node.size()];
    for (int i = 0; i < node.size(); i++) {
      JsonNode element = node.get(i);
      if (!element.isNumber()) {
        throw new VectorDecodeException(
            String.format(
                "unexpected type in embedding array at index %d: %s", i, element.getNodeType()));
      }
      result[i] = element.floatValue();
    }
    return result;
  }
}
