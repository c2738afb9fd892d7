package com.recordsearch.embeddings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecordSimilarityApplication {

  public static void main(String[] args) {
    SpringApplication.run(RecordSimilarityApplication.class, args);
  }
}
