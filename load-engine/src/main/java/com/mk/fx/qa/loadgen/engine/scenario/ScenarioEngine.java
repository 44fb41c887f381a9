package com.mk.fx.qa.loadgen.engine.scenario;

import com.mk.fx.qa.loadgen.engine.error.EngineError;
import com.mk.fx.qa.loadgen.engine.error.EngineError.AssertionFailure;
import com.mk.fx.qa.loadgen.engine.error.EngineError.ExtractionFailure;
import com.mk.fx.qa.loadgen.engine.error.ErrorCategory;
import com.mk.fx.qa.loadgen.engine.scenario.assertion.Assertion;
import com.mk.fx.qa.loadgen.engine.scenario.extract.ExtractionException;
import com.mk.fx.qa.loadgen.engine.scenario.extract.VariableExtraction;
import com.mk.fx.qa.loadgen.rest.HttpMethod;
import com.mk.fx.qa.loadgen.rest.LoadHttpClient;
import com.mk.fx.qa.loadgen.rest.Request;
import com.mk.fx.qa.loadgen.rest.RestResponseData;
import com.mk.fx.qa.loadgen.rest.TransportException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes scenarios step by step: resolves placeholders, replays session cookies, sends the
 * request, checks assertions, extracts variables for later steps and applies think time. The
 * first failing step ends the execution.
 */
@Slf4j
public class ScenarioEngine {

  private static final String COOKIE = "Cookie";

  private final LoadHttpClient client;

  public ScenarioEngine(LoadHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  public ScenarioResult execute(Scenario scenario, VariableContext context, SessionStore session)
      throws InterruptedException {
    return execute(scenario, context, session, () -> false);
  }

  /**
   * Runs every step of {@code scenario} in order.
   *
   * @param cancelled checked before each later step and while pausing between steps
   * @throws InterruptedException if the worker is interrupted or cancelled mid-scenario
   */
  public ScenarioResult execute(
      Scenario scenario, VariableContext context, SessionStore session, BooleanSupplier cancelled)
      throws InterruptedException {
    context.set(VariableContext.TIMESTAMP, Long.toString(System.currentTimeMillis()));

    var start = System.nanoTime();
    List<StepResult> results = new ArrayList<>(scenario.steps().size());
    Integer failedAt = null;

    for (int index = 0; index < scenario.steps().size(); index++) {
      if (index > 0 && cancelled.getAsBoolean()) {
        throw new InterruptedException("Cancelled before step " + index + " of " + scenario.name());
      }
      Step step = scenario.steps().get(index);
      StepResult result = executeStep(step, context, session);
      results.add(result);

      if (!result.success()) {
        failedAt = index;
        log.debug(
            "Scenario {} failed at step {} ({}): {}",
            scenario.name(),
            index,
            step.name(),
            describeFailure(result));
        break;
      }

      if (step.thinkTime() != null) {
        step.thinkTime().pause(cancelled);
      }
    }

    var totalMs = (System.nanoTime() - start) / 1_000_000;
    return new ScenarioResult(
        scenario.name(), failedAt == null, totalMs, results.size(), failedAt, results);
  }

  private StepResult executeStep(Step step, VariableContext context, SessionStore session)
      throws InterruptedException {
    RequestConfig config = step.request();
    String methodName = context.substitute(config.method());
    Optional<HttpMethod> method = HttpMethod.parse(methodName);
    if (method.isEmpty()) {
      return new StepResult(
          step.name(),
          false,
          null,
          0,
          new EngineError.ConfigError(
              "request.method", "unsupported HTTP method '" + methodName + "'"),
          List.of());
    }

    Request request = new Request();
    request.setMethod(method.get());
    request.setPath(context.substitute(config.path()));
    request.setBody(context.substitute(config.body()));
    Map<String, String> headers = context.substitute(config.headers());
    session.cookieHeader().ifPresent(cookies -> mergeCookies(headers, cookies));
    request.setHeaders(headers);

    var start = System.nanoTime();
    RestResponseData response;
    try {
      response = client.execute(request);
    } catch (TransportException e) {
      var elapsed = (System.nanoTime() - start) / 1_000_000;
      var error =
          new EngineError.TransportError(
              ErrorCategory.fromTransportKind(e.getKind()), e.getMessage());
      return new StepResult(step.name(), false, null, elapsed, error, List.of());
    }
    var elapsed = (System.nanoTime() - start) / 1_000_000;

    session.absorb(response.headerValues("Set-Cookie"));

    List<AssertionFailure> failures = new ArrayList<>();
    for (Assertion assertion : step.assertions()) {
      var failure = assertion.check(response);
      failure.ifPresent(failures::add);
    }
    if (!failures.isEmpty()) {
      return new StepResult(
          step.name(), false, response.getStatusCode(), elapsed, null, failures);
    }

    for (VariableExtraction extraction : step.extractions()) {
      try {
        context.set(extraction.variable(), extraction.extractor().extract(response));
      } catch (ExtractionException e) {
        var failure = new ExtractionFailure(extraction.variable(), e.getMessage());
        log.warn("Step {}: {}", step.name(), failure.message());
      }
    }

    return new StepResult(step.name(), true, response.getStatusCode(), elapsed, null, List.of());
  }

  /** Appends session cookies to any explicitly configured Cookie header. */
  private static void mergeCookies(Map<String, String> headers, String sessionCookies) {
    String existingKey = null;
    for (String key : headers.keySet()) {
      if (COOKIE.equalsIgnoreCase(key)) {
        existingKey = key;
        break;
      }
    }
    if (existingKey == null) {
      headers.put(COOKIE, sessionCookies);
    } else {
      headers.put(existingKey, headers.get(existingKey) + "; " + sessionCookies);
    }
  }

  private static String describeFailure(StepResult result) {
    if (result.failure() != null) {
      return result.failure().message();
    }
    return result.assertionFailures().isEmpty()
        ? "unknown"
        : result.assertionFailures().get(0).message();
  }
}
