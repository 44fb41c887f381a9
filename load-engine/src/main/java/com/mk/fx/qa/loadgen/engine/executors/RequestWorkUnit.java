package com.mk.fx.qa.loadgen.engine.executors;

import com.mk.fx.qa.loadgen.engine.error.ErrorCategory;
import com.mk.fx.qa.loadgen.engine.metrics.EngineContext;
import com.mk.fx.qa.loadgen.engine.metrics.RequestOutcome;
import com.mk.fx.qa.loadgen.rest.LoadHttpClient;
import com.mk.fx.qa.loadgen.rest.Request;
import com.mk.fx.qa.loadgen.rest.TransportException;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/** Sends one bare request per iteration and discards the response body. */
@Slf4j
public class RequestWorkUnit implements WorkUnit {

  public static final String LABEL = "requests";

  private final LoadHttpClient client;
  private final Request request;
  private final EngineContext context;

  /** {@code request} is shared by every worker and must not be modified afterwards. */
  public RequestWorkUnit(LoadHttpClient client, Request request, EngineContext context) {
    this.client = Objects.requireNonNull(client, "client");
    this.request = Objects.requireNonNull(request, "request");
    this.context = Objects.requireNonNull(context, "context");
  }

  @Override
  public boolean run(IterationContext iteration) throws InterruptedException {
    Integer status = null;
    ErrorCategory category;
    String message = null;
    var start = System.nanoTime();
    try {
      var response = client.executeDiscardingBody(request);
      status = response.getStatusCode();
      category = ErrorCategory.fromStatusCode(status);
      if (category != null) {
        message = "HTTP " + status;
      }
    } catch (TransportException e) {
      category = ErrorCategory.fromTransportKind(e.getKind());
      message = e.getMessage();
      log.debug(
          "Worker {} request failed ({}): {}", iteration.workerIndex(), category.label(), message);
    }
    var elapsedNanos = System.nanoTime() - start;

    if (context.shouldRecordLatency()) {
      context.getRequestLatency().record(elapsedNanos / 1_000);
    }
    context.getThroughput().record(LABEL, Duration.ofNanos(elapsedNanos));
    if (category != null) {
      context.getErrors().recordFailure(category, message);
    }
    context.publish(new RequestOutcome(LABEL, status, category, elapsedNanos / 1_000_000));
    return category == null;
  }
}
