package com.recordsearch.embeddings.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recordsearch.embeddings.config.ApplicationProperties;
import com.recordsearch.embeddings.dto.EmbeddingMode;
import com.recordsearch.embeddings.dto.FindSimilarRequest;
import com.recordsearch.embeddings.dto.FindSimilarResponse;
import com.recordsearch.embeddings.dto.SimilarRecord;
import com.recordsearch.embeddings.exception.EmbeddingConfigurationException;
import com.recordsearch.embeddings.exception.ResourceNotFoundException;
import com.recordsearch.embeddings.fixtures.TestFixtures;
import com.recordsearch.embeddings.service.cache.EmbeddingCache;
import com.recordsearch.embeddings.service.provider.EmbeddingProvider;
import com.recordsearch.embeddings.service.provider.EmbeddingProviderSelector;
import com.recordsearch.embeddings.service.storage.DatasetRepository;
import com.recordsearch.embeddings.service.storage.InMemoryVectorStore;
import com.recordsearch.embeddings.service.storage.StoredVector;
import com.recordsearch.embeddings.service.storage.VectorStore;
import com.recordsearch.embeddings.service.vector.SimilarityEngine;
import com.recordsearch.embeddings.service.vector.VectorDecoder;

@ExtendWith(MockitoExtension.class)
@DisplayName("SimilaritySearchService Tests")
class SimilaritySearchServiceTest {

  private static final String DS = TestFixtures.DATASET_ID;

  @Mock private DatasetRepository datasetRepository;

  @Mock private EmbeddingProviderSelector providerSelector;

  @Mock private EmbeddingProvider provider;

  private ApplicationProperties properties;
  private InMemoryVectorStore vectorStore;
  private EmbeddingCache cache;

  @BeforeEach
  void setUp() {
    properties = TestFixtures.enabledProperties();
    vectorStore = new InMemoryVectorStore();
    cache = newCache(50_000);

    lenient()
        .when(datasetRepository.findByNameOrId(TestFixtures.DATASET_NAME))
        .thenReturn(Optional.of(TestFixtures.articlesDataset()));
    lenient()
        .when(datasetRepository.findByNameOrId(DS))
        .thenReturn(Optional.of(TestFixtures.articlesDataset()));
    lenient().when(providerSelector.getProvider()).thenReturn(provider);

    vectorStore.upsert("x", DS, "title", new float[] {1f, 0f}, "m", 2);
    vectorStore.upsert("y", DS, "title", new float[] {0f, 1f}, "m", 2);
    vectorStore.upsert("z", DS, "title", new float[] {0.7f, 0.7f}, "m", 2);
  }

  private EmbeddingCache newCache(int maxPerEntry) {
    return new EmbeddingCache(
        500, maxPerEntry, Duration.ofMinutes(10), 6200, new TestFixtures.FakeTicker());
  }

  private SimilaritySearchService service(VectorStore store) {
    EmbeddingTargetResolver resolver =
        new EmbeddingTargetResolver(properties, datasetRepository, providerSelector);
    SimilarityEngine engine =
        new SimilarityEngine(new SimpleAsyncTaskExecutor("similarity-test-"), properties);
    return new SimilaritySearchService(
        resolver, store, new VectorDecoder(new ObjectMapper()), cache, engine, properties);
  }

  private SimilaritySearchService service() {
    return service(vectorStore);
  }

  private static FindSimilarRequest.FindSimilarRequestBuilder titleQuery() {
    return FindSimilarRequest.builder().datasetId(TestFixtures.DATASET_NAME).fieldName("title");
  }

  @Nested
  @DisplayName("Text Queries")
  class TextQueryTests {

    @Test
    @DisplayName("Should rank stored vectors against the embedded text")
    void shouldRankByText() {
      // Given
      when(provider.embedQuery("vector search")).thenReturn(new float[] {1f, 0f});

      // When
      FindSimilarResponse response =
          service().findSimilar(titleQuery().text("vector search").build());

      // Then
      assertThat(response.getResults())
          .extracting(SimilarRecord::getRecordId)
          .containsExactly("x", "z", "y");
      assertThat(response.getDebug().getDatasetId()).isEqualTo(DS);
      assertThat(response.getDebug().getFieldName()).isEqualTo("title");
      assertThat(response.getDebug().getQueryEmbeddingLen()).isEqualTo(2);
      assertThat(response.getDebug().getStoredEmbeddings()).isEqualTo(3);
      assertThat(response.getDebug().getProcessedCount()).isEqualTo(3);
      assertThat(response.getDebug().isCacheHit()).isFalse();
      assertThat(response.getDebug().getCacheStats().getEntriesCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should serve the second query from the cache")
    void shouldHitCacheOnSecondQuery() {
      when(provider.embedQuery(anyString())).thenReturn(new float[] {0f, 1f});
      SimilaritySearchService service = service();
      service.findSimilar(titleQuery().text("first").build());

      FindSimilarResponse second = service.findSimilar(titleQuery().text("second").build());

      assertThat(second.getDebug().isCacheHit()).isTrue();
      assertThat(second.getDebug().getStoredEmbeddings()).isEqualTo(3);
      assertThat(second.getResults().get(0).getRecordId()).isEqualTo("y");
    }

    @Test
    @DisplayName("Should prefer text when a record id is also given, still excluding that record")
    void shouldPreferTextOverRecordId() {
      when(provider.embedQuery("text")).thenReturn(new float[] {0f, 1f});

      FindSimilarResponse response =
          service().findSimilar(titleQuery().text("text").recordId("y").build());

      assertThat(response.getResults())
          .extracting(SimilarRecord::getRecordId)
          .containsExactly("z", "x");
    }

    @Test
    @DisplayName("Should flag a cache skip for oversized sets")
    void shouldFlagCacheSkipped() {
      cache = newCache(2);
      when(provider.embedQuery("text")).thenReturn(new float[] {1f, 0f});

      FindSimilarResponse response = service().findSimilar(titleQuery().text("text").build());

      assertThat(response.getDebug().isCacheSkipped()).isTrue();
      assertThat(response.getResults()).hasSize(3);
      assertThat(cache.info().getEntriesCount()).isZero();
    }

    @Test
    @DisplayName("Should not cache vectors read before a concurrent store invalidated them")
    void shouldNotCacheVectorsOvertakenByInvalidation() {
      // Given
      List<StoredVector> snapshot = vectorStore.findByDatasetField(DS, "title");
      VectorStore store = mock(VectorStore.class);
      when(store.findByDatasetField(DS, "title"))
          .thenAnswer(
              invocation -> {
                // a generation run stores a new vector while this read is in progress
                cache.invalidate(DS, "title");
                return snapshot;
              });
      when(provider.embedQuery("text")).thenReturn(new float[] {1f, 0f});

      // When
      FindSimilarResponse response = service(store).findSimilar(titleQuery().text("text").build());

      // Then
      assertThat(response.getResults()).hasSize(3);
      assertThat(response.getDebug().isCacheSkipped()).isTrue();
      assertThat(cache.get(DS, "title")).isEmpty();
    }
  }

  @Nested
  @DisplayName("Record Queries")
  class RecordQueryTests {

    @Test
    @DisplayName("Should use the stored vector and exclude the record itself")
    void shouldQueryByRecord() {
      FindSimilarResponse response = service().findSimilar(titleQuery().recordId("x").build());

      assertThat(response.getResults())
          .extracting(SimilarRecord::getRecordId)
          .containsExactly("z", "y");
      assertThat(response.getDebug().getProcessedCount()).isEqualTo(2);
      verifyNoInteractions(providerSelector);
    }

    @Test
    @DisplayName("Should return not found when the record has no embedding")
    void shouldFailForRecordWithoutEmbedding() {
      assertThatThrownBy(() -> service().findSimilar(titleQuery().recordId("nope").build()))
          .isInstanceOf(ResourceNotFoundException.class)
          .hasMessage("no embedding found for record nope");
    }

    @Test
    @DisplayName("Should search record embeddings in record mode")
    void shouldUseRecordFieldInRecordMode() {
      vectorStore.upsert("x", DS, EmbeddingMode.RECORD_FIELD_NAME, new float[] {1f, 1f}, "m", 2);
      vectorStore.upsert("w", DS, EmbeddingMode.RECORD_FIELD_NAME, new float[] {1f, 0.9f}, "m", 2);

      FindSimilarResponse response =
          service()
              .findSimilar(
                  FindSimilarRequest.builder()
                      .datasetId(DS)
                      .mode(EmbeddingMode.RECORD)
                      .recordId("x")
                      .build());

      assertThat(response.getDebug().getFieldName()).isEqualTo("_record");
      assertThat(response.getResults()).extracting(SimilarRecord::getRecordId).containsExactly("w");
    }
  }

  @Nested
  @DisplayName("Limits and Decoding")
  class LimitTests {

    @BeforeEach
    void addManyVectors() {
      for (int i = 0; i < 120; i++) {
        vectorStore.upsert("bulk" + i, DS, "title", new float[] {1f, i / 120f}, "m", 2);
      }
    }

    @Test
    @DisplayName("Should default a zero limit")
    void shouldDefaultZeroLimit() {
      FindSimilarResponse response =
          service().findSimilar(titleQuery().recordId("x").limit(0).build());

      assertThat(response.getResults()).hasSize(10);
      assertThat(response.getDebug().getProcessedCount()).isEqualTo(122);
    }

    @Test
    @DisplayName("Should cap the limit at the configured maximum")
    void shouldCapLimit() {
      FindSimilarResponse response =
          service().findSimilar(titleQuery().recordId("x").limit(500).build());

      assertThat(response.getResults()).hasSize(100);
    }

    @Test
    @DisplayName("Should honour an explicit limit")
    void shouldHonourLimit() {
      FindSimilarResponse response =
          service().findSimilar(titleQuery().recordId("x").limit(3).build());

      assertThat(response.getResults()).hasSize(3);
    }
  }

  @Test
  @DisplayName("Should skip undecodable vectors and sample their errors")
  void shouldSkipUndecodableVectors() {
    List<StoredVector> stored = new ArrayList<>(vectorStore.findByDatasetField(DS, "title"));
    for (int i = 0; i < 5; i++) {
      stored.add(StoredVector.builder().recordId("bad" + i).embedding("not json").build());
    }
    VectorStore store = mock(VectorStore.class);
    when(store.findByDatasetField(DS, "title")).thenReturn(stored);
    when(provider.embedQuery("text")).thenReturn(new float[] {1f, 0f});

    FindSimilarResponse response = service(store).findSimilar(titleQuery().text("text").build());

    assertThat(response.getResults()).hasSize(3);
    assertThat(response.getDebug().getStoredEmbeddings()).isEqualTo(8);
    assertThat(response.getDebug().getErrorCount()).isEqualTo(5);
    assertThat(response.getDebug().getErrors()).hasSize(3);
    assertThat(response.getDebug().getErrors().get(0)).startsWith("record bad0: ");
  }

  @Nested
  @DisplayName("Fail Fast")
  class FailFastTests {

    @Test
    @DisplayName("Should reject requests when AI features are disabled")
    void shouldRejectWhenDisabled() {
      properties.getAi().setEnabled(false);

      assertThatThrownBy(() -> service().findSimilar(titleQuery().text("text").build()))
          .isInstanceOf(EmbeddingConfigurationException.class)
          .hasMessage("AI features are not enabled");
      verifyNoInteractions(datasetRepository, providerSelector);
      assertThat(cache.info().getEntriesCount()).isZero();
    }

    @Test
    @DisplayName("Should reject before touching the cache when no provider is configured")
    void shouldRejectWithoutProvider() {
      when(providerSelector.getProvider())
          .thenThrow(new EmbeddingConfigurationException("AI API key is not configured"));

      assertThatThrownBy(() -> service().findSimilar(titleQuery().text("text").build()))
          .isInstanceOf(EmbeddingConfigurationException.class);
      assertThat(cache.info().getEntriesCount()).isZero();
      verify(provider, never()).embedQuery(anyString());
    }

    @Test
    @DisplayName("Should reject an unknown dataset")
    void shouldRejectUnknownDataset() {
      when(datasetRepository.findByNameOrId("other")).thenReturn(Optional.empty());

      assertThatThrownBy(
              () ->
                  service()
                      .findSimilar(
                          FindSimilarRequest.builder()
                              .datasetId("other")
                              .fieldName("title")
                              .text("t")
                              .build()))
          .isInstanceOf(ResourceNotFoundException.class)
          .hasMessage("dataset not found: other");
    }

    @Test
    @DisplayName("Should require a field name in field mode")
    void shouldRequireFieldName() {
      FindSimilarRequest request =
          FindSimilarRequest.builder().datasetId(DS).text("t").build();

      assertThatThrownBy(() -> service().findSimilar(request))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("fieldName is required for field-level mode");
    }

    @Test
    @DisplayName("Should reject an unknown field")
    void shouldRejectUnknownField() {
      FindSimilarRequest request =
          FindSimilarRequest.builder().datasetId(DS).fieldName("missing").text("t").build();

      assertThatThrownBy(() -> service().findSimilar(request))
          .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Should require either text or a record id")
    void shouldRequireQuery() {
      assertThatThrownBy(() -> service().findSimilar(titleQuery().build()))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("either text or recordId must be provided");
      verifyNoInteractions(providerSelector);
    }
  }
}
