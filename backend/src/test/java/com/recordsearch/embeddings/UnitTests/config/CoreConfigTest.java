package com.recordsearch.embeddings.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.ThreadPoolExecutor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.recordsearch.embeddings.fixtures.TestFixtures;
import com.recordsearch.embeddings.service.cache.EmbeddingCache;

public class CoreConfigTest {

  private CoreConfig coreConfig;

  @BeforeEach
  public void setUp() {
    coreConfig = new CoreConfig();
  }

  @Test
  public void testObjectMapperConfiguration() throws Exception {
    ObjectMapper mapper = coreConfig.objectMapper();

    assertThat(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)).isFalse();
    assertThat(mapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)).isFalse();
    assertThat(mapper.writeValueAsString(LocalDateTime.of(2024, 1, 2, 3, 4, 5)))
        .isEqualTo("\"2024-01-02T03:04:05\"");
    assertThat(mapper.writeValueAsString(Duration.ofMinutes(10))).isEqualTo("\"PT10M\"");
  }

  @Test
  public void testEmbeddingCacheUsesConfiguredLimits() {
    ApplicationProperties properties = new ApplicationProperties();
    properties.getCache().setMaxMemoryMb(32);
    properties.getCache().setMaxPerEntry(1000);
    properties.getCache().setTtl(Duration.ofMinutes(3));

    EmbeddingCache cache =
        coreConfig.embeddingCache(properties, new TestFixtures.FakeTicker());

    assertThat(cache.getMaxMemoryMb()).isEqualTo(32.0);
    assertThat(cache.getMaxPerEntry()).isEqualTo(1000);
    assertThat(cache.getTtl()).isEqualTo(Duration.ofMinutes(3));
  }

  @Test
  public void testSimilarityExecutorSizedByParallelism() {
    ThreadPoolTaskExecutor executor =
        coreConfig.similarityExecutor(TestFixtures.enabledProperties());
    try {
      assertThat(executor.getCorePoolSize()).isEqualTo(2);
      assertThat(executor.getMaxPoolSize()).isEqualTo(2);
      assertThat(executor.getThreadNamePrefix()).isEqualTo("similarity-");
      assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
          .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
    } finally {
      executor.shutdown();
    }
  }
}
