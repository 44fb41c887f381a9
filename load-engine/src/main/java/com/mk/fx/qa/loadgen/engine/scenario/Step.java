package com.mk.fx.qa.loadgen.engine.scenario;

import com.mk.fx.qa.loadgen.engine.scenario.assertion.Assertion;
import com.mk.fx.qa.loadgen.engine.scenario.extract.VariableExtraction;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** One request of a scenario with its checks, extractions and optional think time. */
public record Step(
    String name,
    RequestConfig request,
    List<VariableExtraction> extractions,
    List<Assertion> assertions,
    ThinkTime thinkTime) {

  public Step {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(request, "request");
    extractions = extractions == null ? List.of() : List.copyOf(extractions);
    assertions = assertions == null ? List.of() : List.copyOf(assertions);
  }

  public static Step of(String name, RequestConfig request) {
    return new Step(name, request, List.of(), List.of(), null);
  }

  public Optional<ThinkTime> thinkTimeOpt() {
    return Optional.ofNullable(thinkTime);
  }
}
