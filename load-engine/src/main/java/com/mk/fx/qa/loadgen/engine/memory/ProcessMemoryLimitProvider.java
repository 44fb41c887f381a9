package com.mk.fx.qa.loadgen.engine.memory;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the container limit from cgroup v2, then cgroup v1, then falls back to the machine's
 * total memory. Usage is the resident set size from {@code /proc/self/status}, or heap plus
 * non-heap when procfs is unavailable.
 */
@Slf4j
public class ProcessMemoryLimitProvider implements MemoryLimitProvider {

  /** cgroup v1 reports an effectively unlimited value as a huge number. */
  private static final long CGROUP_V1_UNLIMITED = 1L << 60;

  private final Path root;

  public ProcessMemoryLimitProvider() {
    this(Path.of("/"));
  }

  @VisibleForTesting
  ProcessMemoryLimitProvider(Path root) {
    this.root = root;
  }

  @Override
  public Optional<Long> detectLimit() {
    Optional<Long> limit = cgroupV2Limit();
    if (limit.isPresent()) {
      log.debug("Memory limit from cgroup v2: {} bytes", limit.get());
      return limit;
    }
    limit = cgroupV1Limit();
    if (limit.isPresent()) {
      log.debug("Memory limit from cgroup v1: {} bytes", limit.get());
      return limit;
    }
    limit = readKbField("proc/meminfo", "MemTotal:");
    if (limit.isPresent()) {
      log.debug("Memory limit from /proc/meminfo: {} bytes", limit.get());
      return limit;
    }
    return physicalMemory();
  }

  @Override
  public Optional<Long> currentUsage() {
    Optional<Long> rss = readKbField("proc/self/status", "VmRSS:");
    if (rss.isPresent()) {
      return rss;
    }
    var memory = ManagementFactory.getMemoryMXBean();
    long used = memory.getHeapMemoryUsage().getUsed() + memory.getNonHeapMemoryUsage().getUsed();
    return used > 0 ? Optional.of(used) : Optional.empty();
  }

  private Optional<Long> cgroupV2Limit() {
    return readFirstLine("sys/fs/cgroup/memory.max")
        .filter(v -> !v.equals("max"))
        .flatMap(ProcessMemoryLimitProvider::parseLong)
        .filter(v -> v > 0);
  }

  private Optional<Long> cgroupV1Limit() {
    return readFirstLine("sys/fs/cgroup/memory/memory.limit_in_bytes")
        .flatMap(ProcessMemoryLimitProvider::parseLong)
        .filter(v -> v > 0 && v < CGROUP_V1_UNLIMITED);
  }

  private Optional<Long> readKbField(String file, String field) {
    for (String line : readLines(file)) {
      if (line.startsWith(field)) {
        String[] parts = line.substring(field.length()).trim().split("\\s+");
        return parseLong(parts[0]).map(kb -> kb * 1024L);
      }
    }
    return Optional.empty();
  }

  private Optional<Long> physicalMemory() {
    var os = ManagementFactory.getOperatingSystemMXBean();
    if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
      long total = sunOs.getTotalMemorySize();
      if (total > 0) {
        log.debug("Memory limit from JVM physical memory: {} bytes", total);
        return Optional.of(total);
      }
    }
    return Optional.empty();
  }

  private Optional<String> readFirstLine(String file) {
    List<String> lines = readLines(file);
    return lines.isEmpty() ? Optional.empty() : Optional.of(lines.get(0).trim());
  }

  private List<String> readLines(String file) {
    Path path = root.resolve(file);
    if (!Files.isReadable(path)) {
      return List.of();
    }
    try {
      return Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.debug("Unable to read {}: {}", path, e.getMessage());
      return List.of();
    }
  }

  private static Optional<Long> parseLong(String value) {
    try {
      return Optional.of(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
