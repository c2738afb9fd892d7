package com.recordsearch.embeddings.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "embeddings")
public class ApplicationProperties {

  /** JSON file with the dataset catalog loaded at startup. */
  private String datasetsFile = "data/datasets.json";

  private Ai ai = new Ai();
  private Cache cache = new Cache();
  private Similarity similarity = new Similarity();
  private Search search = new Search();
  private Generation generation = new Generation();

  @Data
  public static class Ai {
    private boolean enabled;
    private String provider = "openai";
    private String apiKey;
    private String baseUrl = "https://api.openai.com/v1";
    private String embeddingModel = "text-embedding-3-small";
    private int embeddingDimensions;
    private Duration generationTimeout = Duration.ofSeconds(120);
    private Duration queryTimeout = Duration.ofSeconds(30);
    private Bedrock bedrock = new Bedrock();
  }

  @Data
  public static class Bedrock {
    private String region = "us-east-1";
    private String modelId = "amazon.titan-embed-text-v2:0";
  }

  @Data
  public static class Cache {
    private double maxMemoryMb = 500;
    private int maxPerEntry = 50_000;
    private Duration ttl = Duration.ofMinutes(10);
    /** Estimated bytes per cached vector: 1536 floats, the record id, the magnitude and overhead. */
    private int bytesPerRecord = 6200;
  }

  @Data
  public static class Similarity {
    /** Ranking workers; 0 means one per available processor. */
    private int parallelism;

    public int resolveParallelism() {
      return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }
  }

  @Data
  public static class Search {
    private int defaultLimit = 10;
    private int maxLimit = 100;
  }

  @Data
  public static class Generation {
    private int maxTextsPerBatch = 2048;
    private int maxFieldChars = 2000;
    private int maxReportedErrors = 10;
  }
}
