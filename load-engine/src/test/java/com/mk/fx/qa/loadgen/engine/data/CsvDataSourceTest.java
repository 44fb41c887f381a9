package com.mk.fx.qa.loadgen.engine.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvDataSourceTest {

  private static final String USERS = "username,password\nalice,a1\nbob,b2\ncarol,c3\n";

  @Test
  void nextRow_cyclesInOrder() {
    var source = CsvDataSource.fromString(USERS);

    List<String> names = new ArrayList<>();
    for (int i = 0; i < 7; i++) {
      names.add(source.nextRow().get("username"));
    }

    assertEquals(List.of("alice", "bob", "carol", "alice", "bob", "carol", "alice"), names);
    assertEquals(3, source.rowCount());
    assertEquals(List.of("username", "password"), source.headers());
  }

  @Test
  void reset_rewindsCursor() {
    var source = CsvDataSource.fromString(USERS);
    source.nextRow();
    source.nextRow();
    source.reset();
    assertEquals("alice", source.nextRow().get("username"));
  }

  @Test
  void concurrentCallers_everyFullCycleReturnsEachRowOnce() throws Exception {
    var source = CsvDataSource.fromString(USERS);
    List<String> fetched = Collections.synchronizedList(new ArrayList<>());
    ExecutorService pool = Executors.newFixedThreadPool(4);
    var done = new CountDownLatch(4);
    for (int t = 0; t < 4; t++) {
      pool.submit(
          () -> {
            for (int i = 0; i < 300; i++) {
              fetched.add(source.nextRow().get("username"));
            }
            done.countDown();
          });
    }
    assertTrue(done.await(10, TimeUnit.SECONDS));
    pool.shutdownNow();

    assertEquals(1200, fetched.size());
    assertThat(fetched).filteredOn("alice"::equals).hasSize(400);
    assertThat(fetched).filteredOn("bob"::equals).hasSize(400);
    assertThat(fetched).filteredOn("carol"::equals).hasSize(400);
  }

  @Test
  void quotedFields_andEmptyLines_areHandled() {
    var source =
        CsvDataSource.fromString("name,address\n\n\"Smith, John\",\"12 \"\"Main\"\" St\"\n\n");

    Map<String, String> row = source.nextRow();
    assertEquals(1, source.rowCount());
    assertEquals("Smith, John", row.get("name"));
    assertEquals("12 \"Main\" St", row.get("address"));
  }

  @Test
  void headerOnly_isAConfigurationError() {
    var ex = assertThrows(DataSourceException.class, () -> CsvDataSource.fromString("a,b\n"));
    assertTrue(ex.getMessage().contains("no data rows"));
    assertThrows(DataSourceException.class, () -> CsvDataSource.fromString(""));
  }

  @Test
  void fromFile_readsCsv(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("users.csv");
    Files.writeString(file, USERS);

    var source = CsvDataSource.fromFile(file);

    assertEquals("b2", source.row(1).get("password"));
  }

  @Test
  void leadingByteOrderMark_isStrippedFromFirstHeader() {
    var source = CsvDataSource.fromString("\uFEFFid,name\n1,a\n");

    assertEquals(List.of("id", "name"), source.headers());
    assertEquals(Map.of("id", "1", "name", "a"), source.nextRow());
  }

  @Test
  void fromFile_excelExportWithByteOrderMark(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("export.csv");
    Files.write(
        file,
        new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'i', 'd', ',', 'n', '\n', '7', ',', 'x', '\n'});

    var source = CsvDataSource.fromFile(file);

    assertEquals("7", source.nextRow().get("id"));
  }

  @Test
  void fromFile_missingFileFails(@TempDir Path dir) {
    assertThrows(DataSourceException.class, () -> CsvDataSource.fromFile(dir.resolve("nope.csv")));
  }

  @Test
  void rows_areImmutable() {
    var row = CsvDataSource.fromString(USERS).nextRow();
    assertThrows(UnsupportedOperationException.class, () -> row.put("username", "mallory"));
  }
}
