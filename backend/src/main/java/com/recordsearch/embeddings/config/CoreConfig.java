package com.recordsearch.embeddings.config;

import java.util.concurrent.ThreadPoolExecutor;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.base.Ticker;
import com.recordsearch.embeddings.service.cache.EmbeddingCache;

@Configuration
public class CoreConfig {

  @Bean
  public ObjectMapper objectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    return mapper;
  }

  @Bean
  public Ticker cacheTicker() {
    return Ticker.systemTicker();
  }

  @Bean
  public EmbeddingCache embeddingCache(ApplicationProperties properties, Ticker cacheTicker) {
    ApplicationProperties.Cache cache = properties.getCache();
    return new EmbeddingCache(
        cache.getMaxMemoryMb(),
        cache.getMaxPerEntry(),
        cache.getTtl(),
        cache.getBytesPerRecord(),
        cacheTicker);
  }

  @Bean(name = "similarityExecutor")
  public ThreadPoolTaskExecutor similarityExecutor(ApplicationProperties properties) {
    int workers = properties.getSimilarity().resolveParallelism();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setQueueCapacity(workers * 64); // several searches may rank at once
    executor.setThreadNamePrefix("similarity-");
    executor.setDaemon(true);
    // A saturated pool scores the chunk on the searching thread instead of failing the search.
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }

  /** Client for batch embedding calls made while generating embeddings. */
  @Bean(name = "embeddingRestTemplate")
  public RestTemplate embeddingRestTemplate(
      RestTemplateBuilder builder, ApplicationProperties properties) {
    return builder
        .setConnectTimeout(properties.getAi().getQueryTimeout())
        .setReadTimeout(properties.getAi().getGenerationTimeout())
        .build();
  }

  /** Client for the single-text embedding made per similarity query. */
  @Bean(name = "embeddingQueryRestTemplate")
  public RestTemplate embeddingQueryRestTemplate(
      RestTemplateBuilder builder, ApplicationProperties properties) {
    return builder
        .setConnectTimeout(properties.getAi().getQueryTimeout())
        .setReadTimeout(properties.getAi().getQueryTimeout())
        .build();
  }
}
