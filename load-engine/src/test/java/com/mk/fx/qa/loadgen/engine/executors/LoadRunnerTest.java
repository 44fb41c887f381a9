package com.mk.fx.qa.loadgen.engine.executors;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.loadgen.engine.cfg.RuntimeConfigHolder;
import com.mk.fx.qa.loadgen.engine.metrics.EngineContext;
import com.mk.fx.qa.loadgen.engine.model.LoadModel;
import com.mk.fx.qa.loadgen.engine.scenario.SessionStore;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class LoadRunnerTest {

  @Test
  void workersTogetherApproximateAggregateRate() throws Exception {
    var calls = new AtomicInteger();
    var config = new RuntimeConfigHolder(new LoadModel.Rps(200));

    var result =
        LoadRunner.execute(
            "rate",
            new RunParameters(4, Duration.ofMillis(500)),
            config,
            new EngineContext(),
            it -> {
              calls.incrementAndGet();
              return true;
            },
            () -> false);

    // 200 rps over 0.5 s
    assertTrue(result.iterations() >= 70 && result.iterations() <= 120, "iterations " + result.iterations());
    assertEquals(calls.get(), result.iterations());
    assertEquals(4, result.workers());
    assertFalse(result.cancelled());
  }

  @Test
  void eachWorkerOwnsOneSession_onItsOwnNamedThread() throws Exception {
    Map<Integer, Set<SessionStore>> sessions = new ConcurrentHashMap<>();
    Set<String> threadNames = ConcurrentHashMap.newKeySet();
    var config = new RuntimeConfigHolder(new LoadModel.Rps(100));

    LoadRunner.execute(
        "sessions",
        new RunParameters(3, Duration.ofMillis(300)),
        config,
        new EngineContext(),
        it -> {
          sessions.computeIfAbsent(it.workerIndex(), k -> ConcurrentHashMap.newKeySet()).add(it.session());
          threadNames.add(Thread.currentThread().getName());
          it.session().size();
          return true;
        },
        () -> false);

    assertEquals(Set.of(0, 1, 2), sessions.keySet());
    sessions.values().forEach(s -> assertEquals(1, s.size()));
    assertTrue(threadNames.stream().allMatch(n -> n.startsWith("load-worker-sessions-")));
  }

  @Test
  void failuresAreCounted_andCancellationIsReported() throws Exception {
    var cancel = new AtomicBoolean();
    var calls = new AtomicInteger();
    var config = new RuntimeConfigHolder(new LoadModel.Rps(100));

    var result =
        LoadRunner.execute(
            "cancel",
            new RunParameters(2, Duration.ofSeconds(10)),
            config,
            new EngineContext(),
            it -> {
              if (calls.incrementAndGet() >= 5) {
                cancel.set(true);
              }
              return false;
            },
            cancel::get);

    assertTrue(result.cancelled());
    assertEquals(result.iterations(), result.failures());
    assertTrue(result.elapsed().toMillis() < 5_000);
  }
}
