package com.recordsearch.embeddings.service.storage;

import java.util.List;
import java.util.Optional;

/** Read access to datasets and their records, plus the writes needed to populate them. */
public interface DatasetRepository {

  /**
   * Finds a dataset by id, or by name when no id matches.
   *
   * @param nameOrId dataset id or name
   * @return the dataset if found
   */
  Optional<Dataset> findByNameOrId(String nameOrId);

  List<Dataset> findAll();

  /**
   * Finds all records of a dataset in insertion order.
   *
   * @param datasetId canonical dataset id
   * @return the records, empty if none
   */
  List<DatasetRecord> findRecords(String datasetId);

  Optional<DatasetRecord> findRecord(String datasetId, String recordId);

  Dataset save(Dataset dataset);

  DatasetRecord saveRecord(DatasetRecord record);
}
