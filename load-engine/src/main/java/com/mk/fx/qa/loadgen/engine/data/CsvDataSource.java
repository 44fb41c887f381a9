package com.mk.fx.qa.loadgen.engine.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Round-robin source of CSV rows shared by all workers. The first record is the header row;
 * quoting follows RFC 4180 and empty lines are skipped. Rows are handed out in order, wrapping
 * around, from a single atomic cursor.
 */
@Slf4j
public final class CsvDataSource {

  private static final CsvMapper CSV_MAPPER = new CsvMapper();

  /** Byte order mark spreadsheet exports put before the first header. */
  private static final String BOM = "\uFEFF";

  private final List<String> headers;
  private final List<Map<String, String>> rows;
  private final AtomicLong cursor = new AtomicLong();

  private CsvDataSource(List<String> headers, List<Map<String, String>> rows) {
    this.headers = List.copyOf(headers);
    this.rows = List.copyOf(rows);
  }

  public static CsvDataSource fromString(String csv) {
    if (csv == null) {
      throw new DataSourceException("CSV content is null");
    }
    return parse(new StringReader(csv), "<inline>");
  }

  public static CsvDataSource fromFile(Path path) {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    } catch (IOException e) {
      throw new DataSourceException("Failed to read CSV file " + path + ": " + e.getMessage(), e);
    }
  }

  private static CsvDataSource parse(Reader reader, String origin) {
    List<List<String>> records = new ArrayList<>();
    try (MappingIterator<List<String>> it =
        CSV_MAPPER
            .readerForListOf(String.class)
            .with(CsvParser.Feature.WRAP_AS_ARRAY)
            .with(CsvParser.Feature.SKIP_EMPTY_LINES)
            .readValues(reader)) {
      while (it.hasNextValue()) {
        List<String> record = it.nextValue();
        if (!isBlank(record)) {
          records.add(record);
        }
      }
    } catch (IOException e) {
      throw new DataSourceException("Malformed CSV in " + origin + ": " + e.getMessage(), e);
    }

    if (records.isEmpty()) {
      throw new DataSourceException("CSV in " + origin + " has no header row");
    }
    List<String> headers = new ArrayList<>(records.get(0).size());
    for (String header : records.get(0)) {
      headers.add(headers.isEmpty() ? stripBom(header).trim() : header.trim());
    }
    List<Map<String, String>> rows = new ArrayList<>(records.size() - 1);
    for (List<String> record : records.subList(1, records.size())) {
      Map<String, String> row = new LinkedHashMap<>();
      for (int i = 0; i < headers.size(); i++) {
        row.put(headers.get(i), i < record.size() ? record.get(i) : "");
      }
      rows.add(Collections.unmodifiableMap(row));
    }
    if (rows.isEmpty()) {
      throw new DataSourceException("CSV in " + origin + " has no data rows");
    }
    log.info("Loaded {} CSV rows with columns {} from {}", rows.size(), headers, origin);
    return new CsvDataSource(headers, rows);
  }

  private static String stripBom(String header) {
    return header.startsWith(BOM) ? header.substring(1) : header;
  }

  private static boolean isBlank(List<String> record) {
    return record.isEmpty() || (record.size() == 1 && record.get(0).isBlank());
  }

  /** Next row in round-robin order; safe for concurrent callers. */
  public Map<String, String> nextRow() {
    long index = cursor.getAndIncrement();
    return rows.get((int) Math.floorMod(index, (long) rows.size()));
  }

  /** Rewinds the cursor to the first row. */
  public void reset() {
    cursor.set(0);
  }

  public int rowCount() {
    return rows.size();
  }

  public Map<String, String> row(int index) {
    return rows.get(index);
  }

  public List<String> headers() {
    return headers;
  }
}
