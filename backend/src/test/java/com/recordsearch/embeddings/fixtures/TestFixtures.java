package com.recordsearch.embeddings.fixtures;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Ticker;
import com.recordsearch.embeddings.config.ApplicationProperties;
import com.recordsearch.embeddings.service.storage.Dataset;
import com.recordsearch.embeddings.service.storage.DatasetField;
import com.recordsearch.embeddings.service.storage.DatasetRecord;
import com.recordsearch.embeddings.service.storage.FieldType;
import com.recordsearch.embeddings.service.vector.CachedVector;

/** Shared builders for datasets, records and vectors used across tests. */
public final class TestFixtures {

  public static final String DATASET_ID = "ds_articles";
  public static final String DATASET_NAME = "articles";

  private TestFixtures() {}

  public static Dataset articlesDataset() {
    return Dataset.builder()
        .id(DATASET_ID)
        .name(DATASET_NAME)
        .fields(
            new ArrayList<>(
                List.of(
                    field("title", FieldType.TEXT, true),
                    field("body", FieldType.EDITOR, true),
                    field("summary", FieldType.TEXT, false),
                    field("author_email", FieldType.EMAIL, false),
                    field("views", FieldType.NUMBER, false))))
        .build();
  }

  public static DatasetField field(String name, FieldType type, boolean embeddable) {
    return DatasetField.builder().name(name).type(type).embeddable(embeddable).build();
  }

  public static DatasetRecord record(String id, Object... keyValues) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      values.put((String) keyValues[i], keyValues[i + 1]);
    }
    return DatasetRecord.builder().id(id).datasetId(DATASET_ID).values(values).build();
  }

  public static List<CachedVector> vectors(int count, int dimensions) {
    List<CachedVector> vectors = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      float[] v = new float[dimensions];
      for (int d = 0; d < dimensions; d++) {
        v[d] = (float) Math.sin(i * 31 + d);
      }
      vectors.add(CachedVector.of(String.format("r%05d", i), v));
    }
    return vectors;
  }

  public static ApplicationProperties enabledProperties() {
    ApplicationProperties properties = new ApplicationProperties();
    properties.getAi().setEnabled(true);
    properties.getAi().setApiKey("sk-test");
    properties.getSimilarity().setParallelism(2);
    return properties;
  }

  /** Manually advanced clock for TTL tests. */
  public static final class FakeTicker extends Ticker {
    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long read() {
      return nanos.get();
    }

    public FakeTicker advance(long amount, TimeUnit unit) {
      nanos.addAndGet(unit.toNanos(amount));
      return this;
    }
  }
}
