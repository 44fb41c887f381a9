package com.mk.fx.qa.loadgen.engine.executors;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.loadgen.engine.cfg.RuntimeConfigHolder;
import com.mk.fx.qa.loadgen.engine.error.ErrorCategory;
import com.mk.fx.qa.loadgen.engine.metrics.EngineContext;
import com.mk.fx.qa.loadgen.engine.metrics.OutcomeListener;
import com.mk.fx.qa.loadgen.engine.metrics.RequestOutcome;
import com.mk.fx.qa.loadgen.engine.model.LoadModel;
import com.mk.fx.qa.loadgen.engine.scenario.SessionStore;
import com.mk.fx.qa.loadgen.rest.HttpMethod;
import com.mk.fx.qa.loadgen.rest.LoadHttpClient;
import com.mk.fx.qa.loadgen.rest.Request;
import com.sun.net.httpserver.HttpServer;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RequestWorkUnitTest {

  private HttpServer server;
  private String baseUrl;

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext("/ok", exchange -> respond(exchange, 200));
    server.createContext("/err", exchange -> respond(exchange, 500));
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status)
      throws java.io.IOException {
    byte[] body = "a fairly large body that is discarded".getBytes();
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(body);
    }
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
  }

  private static Request get(String path) {
    var request = new Request();
    request.setMethod(HttpMethod.GET);
    request.setPath(path);
    return request;
  }

  private static IterationContext iteration() {
    return new IterationContext(
        0, new SessionStore(), new RuntimeConfigHolder(new LoadModel.Concurrent()).current(), () -> false);
  }

  @Test
  void success_recordsLatencyThroughputAndOutcome() throws Exception {
    var context = new EngineContext();
    List<RequestOutcome> outcomes = new CopyOnWriteArrayList<>();
    context.addListener(new OutcomeListener() {
      @Override
      public void onRequest(RequestOutcome outcome) {
        outcomes.add(outcome);
      }
    });
    var unit = new RequestWorkUnit(new LoadHttpClient(baseUrl, 2, Map.of()), get("/ok"), context);

    assertTrue(unit.run(iteration()));

    assertEquals(1, context.getRequestLatency().stats().orElseThrow().count());
    assertEquals(1, context.getThroughput().stats(RequestWorkUnit.LABEL).orElseThrow().totalCount());
    assertEquals(200, outcomes.get(0).status());
    assertFalse(outcomes.get(0).isError());
  }

  @Test
  void serverError_isCategorised() throws Exception {
    var context = new EngineContext();
    var unit = new RequestWorkUnit(new LoadHttpClient(baseUrl, 2, Map.of()), get("/err"), context);

    assertFalse(unit.run(iteration()));

    assertEquals(1L, context.getErrors().breakdownSnapshot().get(ErrorCategory.SERVER_ERROR));
  }

  @Test
  void transportFailure_isCategorised_andThroughputStillCounts() throws Exception {
    var context = new EngineContext();
    var unit =
        new RequestWorkUnit(new LoadHttpClient("http://127.0.0.1:1", 2, 2, Map.of()), get("/"), context);

    assertFalse(unit.run(iteration()));

    assertEquals(1L, context.getErrors().breakdownSnapshot().get(ErrorCategory.NETWORK_ERROR));
    assertEquals(1, context.getThroughput().stats(RequestWorkUnit.LABEL).orElseThrow().totalCount());
  }

  @Test
  void trackingDisabled_skipsLatencyButNotThroughput() throws Exception {
    var context = new EngineContext();
    context.disableLatencyTracking();
    var unit = new RequestWorkUnit(new LoadHttpClient(baseUrl, 2, Map.of()), get("/ok"), context);

    unit.run(iteration());

    assertTrue(context.getRequestLatency().stats().isEmpty());
    assertEquals(1, context.getThroughput().stats(RequestWorkUnit.LABEL).orElseThrow().totalCount());
  }
}
