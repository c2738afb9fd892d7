package com.recordsearch.embeddings.service.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recordsearch.embeddings.config.ApplicationProperties;

import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Dataset catalog seeded from a JSON file at startup and kept in memory afterwards. The file holds
 * a {@code datasets} array; each dataset lists its fields and, optionally, its records.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FileBasedDatasetRepository implements DatasetRepository {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;

  private final Map<String, Dataset> datasets = new ConcurrentHashMap<>();
  private final Map<String, Map<String, DatasetRecord>> records = new ConcurrentHashMap<>();
  private Path datasetsFile;

  @PostConstruct
  public void init() {
    String overridden = System.getProperty("EMBEDDINGS_DATASETS_FILE");
    String targetPath =
        overridden != null && !overridden.isBlank()
            ? overridden
            : applicationProperties.getDatasetsFile();
    datasetsFile = Paths.get(targetPath);
    loadDatasets();
  }

  @Override
  public Optional<Dataset> findByNameOrId(String nameOrId) {
    if (nameOrId == null) {
      return Optional.empty();
    }
    Dataset byId = datasets.get(nameOrId);
    if (byId != null) {
      return Optional.of(byId);
    }
    return datasets.values().stream().filter(d -> nameOrId.equals(d.getName())).findFirst();
  }

  @Override
  public List<Dataset> findAll() {
    return new ArrayList<>(datasets.values());
  }

  @Override
  public List<DatasetRecord> findRecords(String datasetId) {
    Map<String, DatasetRecord> datasetRecords = records.get(datasetId);
    if (datasetRecords == null) {
      return new ArrayList<>();
    }
    synchronized (datasetRecords) {
      return new ArrayList<>(datasetRecords.values());
    }
  }

  @Override
  public Optional<DatasetRecord> findRecord(String datasetId, String recordId) {
    Map<String, DatasetRecord> datasetRecords = records.get(datasetId);
    if (datasetRecords == null || recordId == null) {
      return Optional.empty();
    }
    synchronized (datasetRecords) {
      return Optional.ofNullable(datasetRecords.get(recordId));
    }
  }

  @Override
  public Dataset save(Dataset dataset) {
    if (dataset.getId() == null || dataset.getId().isBlank()) {
      dataset.setId(UUID.randomUUID().toString());
    }
    datasets.put(dataset.getId(), dataset);
    records.computeIfAbsent(dataset.getId(), id -> new LinkedHashMap<>());
    return dataset;
  }

  @Override
  public DatasetRecord saveRecord(DatasetRecord record) {
    if (!datasets.containsKey(record.getDatasetId())) {
      throw new IllegalArgumentException("unknown dataset: " + record.getDatasetId());
    }
    if (record.getId() == null || record.getId().isBlank()) {
      record.setId(UUID.randomUUID().toString());
    }
    Map<String, DatasetRecord> datasetRecords =
        records.computeIfAbsent(record.getDatasetId(), id -> new LinkedHashMap<>());
    synchronized (datasetRecords) {
      datasetRecords.put(record.getId(), record);
    }
    return record;
  }

  private void loadDatasets() {
    if (!Files.exists(datasetsFile)) {
      log.debug("No datasets file found at {}, starting with an empty catalog", datasetsFile);
      return;
    }

    try {
      CatalogFile catalog = objectMapper.readValue(datasetsFile.toFile(), CatalogFile.class);
      if (catalog.getDatasets() == null) {
        return;
      }
      for (SeedDataset seed : catalog.getDatasets()) {
        Dataset dataset =
            save(
                Dataset.builder()
                    .id(seed.getId())
                    .name(seed.getName())
                    .fields(seed.getFields() == null ? new ArrayList<>() : seed.getFields())
                    .build());
        if (seed.getRecords() != null) {
          for (DatasetRecord record : seed.getRecords()) {
            record.setDatasetId(dataset.getId());
            saveRecord(record);
          }
        }
      }
      log.info("Loaded {} datasets from {}", datasets.size(), datasetsFile);
    } catch (IOException e) {
      log.error("Failed to load datasets from {}", datasetsFile, e);
      throw new IllegalStateException("Failed to load datasets file " + datasetsFile, e);
    }
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  static class CatalogFile {
    private List<SeedDataset> datasets;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  static class SeedDataset {
    private String id;
    private String name;
    private List<DatasetField> fields;
    private List<DatasetRecord> records;
  }
}
