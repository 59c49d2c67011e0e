package com.scholary.transcripthub.evaluation;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Persists evaluation records as one CSV table per (provider, dataset, language).
 *
 * <p>The table is rewritten in full after every sample, through a sibling temp file moved into
 * place, so an interrupted run leaves either the previous or the new table and never a torn one.
 */
@Component
public class EvaluationResultStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(EvaluationResultStore.class);

  private final Path resultsDir;
  private final CsvMapper csvMapper = new CsvMapper();
  private final CsvSchema schema = csvMapper.schemaFor(EvaluationRecord.class).withHeader();

  @Autowired
  public EvaluationResultStore(EvaluationProperties properties) {
    this(Path.of(properties.resultsDir()));
  }

  EvaluationResultStore(Path resultsDir) {
    this.resultsDir = resultsDir;
  }

  public Path resultsFile(String provider, String dataset, String language) {
    return resultsDir.resolve(provider + "_" + dataset + "_" + language + "_results.csv");
  }

  public boolean exists(String provider, String dataset, String language) {
    return Files.exists(resultsFile(provider, dataset, language));
  }

  /** Load persisted records, or an empty list when nothing has been recorded yet. */
  public List<EvaluationRecord> load(String provider, String dataset, String language)
      throws IOException {
    Path file = resultsFile(provider, dataset, language);
    if (!Files.exists(file)) {
      return new ArrayList<>();
    }
    List<EvaluationRecord> records = new ArrayList<>();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        MappingIterator<EvaluationRecord> rows =
            csvMapper.readerFor(EvaluationRecord.class).with(schema).readValues(reader)) {
      while (rows.hasNext()) {
        records.add(rows.next());
      }
    }
    LOGGER.debug("Loaded {} records from {}", records.size(), file);
    return records;
  }

  /** Replace the persisted table with {@code records}. */
  public void save(String provider, String dataset, String language, List<EvaluationRecord> records)
      throws IOException {
    Path file = resultsFile(provider, dataset, language);
    Files.createDirectories(resultsDir);
    Path partial = file.resolveSibling(file.getFileName() + ".partial");

    ObjectWriter writer = csvMapper.writer(schema);
    try (Writer out = Files.newBufferedWriter(partial, StandardCharsets.UTF_8)) {
      writer.writeValues(out).writeAll(records).close();
    }
    Files.move(
        partial, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    LOGGER.debug("Saved {} records to {}", records.size(), file);
  }
}
