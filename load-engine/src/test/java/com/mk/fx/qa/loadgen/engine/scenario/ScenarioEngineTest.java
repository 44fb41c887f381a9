package com.mk.fx.qa.loadgen.engine.scenario;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.loadgen.engine.error.EngineError;
import com.mk.fx.qa.loadgen.engine.error.ErrorCategory;
import com.mk.fx.qa.loadgen.engine.scenario.assertion.Assertion;
import com.mk.fx.qa.loadgen.engine.scenario.extract.Extractor;
import com.mk.fx.qa.loadgen.engine.scenario.extract.VariableExtraction;
import com.mk.fx.qa.loadgen.rest.LoadHttpClient;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScenarioEngineTest {

  private HttpServer server;
  private ScenarioEngine engine;
  private final AtomicInteger secondStepHits = new AtomicInteger();
  private final List<String> seenCookies = new CopyOnWriteArrayList<>();
  private final List<String> seenAuth = new CopyOnWriteArrayList<>();
  private final List<String> seenQueries = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext(
        "/login",
        exchange -> {
          exchange.getResponseHeaders().add("Set-Cookie", "session=abc; Path=/; HttpOnly");
          exchange.getResponseHeaders().add("Content-Type", "application/json");
          respond(exchange, 200, "{\"token\":\"t-1\",\"user\":{\"id\":7,\"roles\":[\"admin\"]}}");
        });
    server.createContext(
        "/profile",
        exchange -> {
          secondStepHits.incrementAndGet();
          String cookie = exchange.getRequestHeaders().getFirst("Cookie");
          seenCookies.add(cookie == null ? "" : cookie);
          String auth = exchange.getRequestHeaders().getFirst("Authorization");
          seenAuth.add(auth == null ? "" : auth);
          respond(exchange, 200, "{\"path\":\"" + exchange.getRequestURI().getPath() + "\"}");
        });
    server.createContext("/missing", exchange -> respond(exchange, 404, "not found"));
    server.createContext(
        "/echo",
        exchange -> {
          seenQueries.add(exchange.getRequestURI().getQuery());
          respond(exchange, 200, "ok");
        });
    server.start();
    var baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    engine = new ScenarioEngine(new LoadHttpClient(baseUrl, 2, Map.of()));
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  private static Step step(String name, RequestConfig request, List<Assertion> assertions) {
    return new Step(name, request, List.of(), assertions, null);
  }

  @Test
  void failedAssertion_stopsScenarioAtThatStep() throws Exception {
    var scenario =
        new Scenario(
            "fail-fast",
            List.of(
                step("missing", RequestConfig.get("/missing"), List.of(new Assertion.StatusCode(200))),
                step("profile", RequestConfig.get("/profile/1"), List.of())));

    var result = engine.execute(scenario, new VariableContext(), new SessionStore());

    assertFalse(result.success());
    assertEquals(1, result.stepsCompleted());
    assertEquals(0, result.failedAtStep());
    assertEquals(0, secondStepHits.get());

    StepResult first = result.steps().get(0);
    assertEquals(404, first.status());
    assertTrue(first.errorMessage().isEmpty());
    assertEquals(1, first.assertionFailures().size());
    assertEquals(
        "Status code mismatch: expected 200, got 404", first.assertionFailures().get(0).message());
  }

  @Test
  void everyAssertionIsEvaluated_andAllFailuresReported() throws Exception {
    var scenario =
        new Scenario(
            "all-assertions",
            List.of(
                step(
                    "missing",
                    RequestConfig.get("/missing"),
                    List.of(
                        new Assertion.StatusCode(200),
                        new Assertion.BodyContains("found"),
                        new Assertion.BodyContains("nope")))));

    var result = engine.execute(scenario, new VariableContext(), new SessionStore());

    assertFalse(result.success());
    var failures = result.steps().get(0).assertionFailures();
    assertEquals(2, failures.size());
    assertEquals("Status code mismatch: expected 200, got 404", failures.get(0).message());
    assertEquals("Response body does not contain 'nope'", failures.get(1).message());
  }

  @Test
  void unresolvedPlaceholdersAndSpaces_areEncodedAndSent() throws Exception {
    List<String> rawPaths = new CopyOnWriteArrayList<>();
    server.createContext(
        "/x",
        exchange -> {
          rawPaths.add(exchange.getRequestURI().getRawPath());
          respond(exchange, 200, "ok");
        });
    var scenario =
        new Scenario(
            "encoded",
            List.of(
                step("unbound", RequestConfig.get("/x/${missing}"), List.of()),
                step("spaced", RequestConfig.get("/echo?q=${name}"), List.of())));

    var result =
        engine.execute(
            scenario, new VariableContext().set("name", "John Smith"), new SessionStore());

    assertTrue(result.success(), () -> "unexpected failure: " + result);
    assertEquals(200, result.steps().get(0).status());
    assertNull(result.steps().get(0).failure());
    assertEquals(List.of("/x/$%7Bmissing%7D"), rawPaths);
    assertEquals(List.of("q=John Smith"), seenQueries);
  }

  @Test
  void cancellation_isCheckedBeforeLaterSteps() {
    var scenario =
        new Scenario(
            "cancelled",
            List.of(
                step("first", RequestConfig.get("/echo"), List.of()),
                step("profile", RequestConfig.get("/profile/1"), List.of())));

    assertThrows(
        InterruptedException.class,
        () -> engine.execute(scenario, new VariableContext(), new SessionStore(), () -> true));
    assertEquals(1, seenQueries.size());
    assertEquals(0, secondStepHits.get());
  }

  @Test
  void extractedValuesAndCookies_flowIntoLaterSteps() throws Exception {
    var login =
        new Step(
            "login",
            RequestConfig.post("/login", "{\"user\":\"${username}\"}"),
            List.of(
                VariableExtraction.jsonPath("token", "$.token"),
                VariableExtraction.jsonPath("userId", "$.user.id"),
                new VariableExtraction("role", new Extractor.JsonPath("$.user.roles[0]"))),
            List.of(new Assertion.StatusCode(200), new Assertion.HeaderExists("Set-Cookie")),
            null);
    var profile =
        step(
            "profile",
            RequestConfig.get("/profile/${userId}").withHeader("Authorization", "Bearer ${token}"),
            List.of(new Assertion.JsonPath("$.path", "/profile/7")));
    var ctx = new VariableContext().set("username", "alice");

    var result = engine.execute(new Scenario("journey", List.of(login, profile)), ctx, new SessionStore());

    assertTrue(result.success(), () -> "unexpected failure: " + result);
    assertEquals(2, result.stepsCompleted());
    assertNull(result.failedAtStep());
    assertEquals("t-1", ctx.get("token").orElseThrow());
    assertEquals("admin", ctx.get("role").orElseThrow());
    assertEquals(List.of("session=abc"), seenCookies);
    assertEquals(List.of("Bearer t-1"), seenAuth);
  }

  @Test
  void sessionCookies_persistAcrossIterations() throws Exception {
    var session = new SessionStore();
    var login = new Scenario("login", List.of(step("login", RequestConfig.post("/login", "{}"), List.of())));
    var profile = new Scenario("profile", List.of(step("profile", RequestConfig.get("/profile/1"), List.of())));

    engine.execute(login, new VariableContext(), session);
    engine.execute(profile, new VariableContext(), session);

    assertEquals(List.of("session=abc"), seenCookies);
  }

  @Test
  void failedExtraction_doesNotFailTheStep() throws Exception {
    var login =
        new Step(
            "login",
            RequestConfig.post("/login", "{}"),
            List.of(VariableExtraction.jsonPath("missing", "$.does.not.exist")),
            List.of(),
            null);
    var ctx = new VariableContext();

    var result = engine.execute(new Scenario("s", List.of(login)), ctx, new SessionStore());

    assertTrue(result.success());
    assertFalse(ctx.contains("missing"));
  }

  @Test
  void transportFailure_marksStepFailedWithoutStatus() throws Exception {
    var unreachable = new ScenarioEngine(new LoadHttpClient("http://127.0.0.1:1", 2, 2, Map.of()));
    var scenario =
        new Scenario(
            "down",
            List.of(
                step("a", RequestConfig.get("/a"), List.of()),
                step("b", RequestConfig.get("/b"), List.of())));

    var result = unreachable.execute(scenario, new VariableContext(), new SessionStore());

    assertFalse(result.success());
    assertEquals(1, result.stepsCompleted());
    assertEquals(0, result.failedAtStep());
    var step = result.steps().get(0);
    assertNull(step.status());
    assertTrue(step.errorMessage().isPresent());
    var error = assertInstanceOf(EngineError.TransportError.class, step.failure());
    assertEquals(ErrorCategory.NETWORK_ERROR, error.category());
  }

  @Test
  void unresolvableTemplatedMethod_isAConfigError() throws Exception {
    var scenario =
        new Scenario(
            "templated",
            List.of(step("x", new RequestConfig("${verb}", "/echo", null, Map.of()), List.of())));

    var result =
        engine.execute(scenario, new VariableContext().set("verb", "FETCH"), new SessionStore());

    assertFalse(result.success());
    assertInstanceOf(EngineError.ConfigError.class, result.steps().get(0).failure());
  }

  @Test
  void timestamp_isStableWithinOneExecution() throws Exception {
    var scenario =
        new Scenario(
            "ts",
            List.of(
                step("first", RequestConfig.get("/echo?t=${timestamp}"), List.of()),
                step("second", RequestConfig.get("/echo?t=${timestamp}"), List.of())));

    engine.execute(scenario, new VariableContext(), new SessionStore());

    assertThat(seenQueries).hasSize(2);
    assertEquals(seenQueries.get(0), seenQueries.get(1));
    assertThat(seenQueries.get(0)).matches("t=\\d+");
  }

  @Test
  void thinkTime_isNotCountedInStepLatency() throws Exception {
    var scenario =
        new Scenario(
            "think",
            List.of(
                new Step(
                    "echo",
                    RequestConfig.get("/echo"),
                    List.of(),
                    List.of(),
                    ThinkTime.fixed(Duration.ofMillis(300)))));

    var result = engine.execute(scenario, new VariableContext(), new SessionStore());

    assertTrue(result.totalTimeMs() >= 300);
    assertTrue(result.steps().get(0).elapsedMs() < 300);
  }
}
