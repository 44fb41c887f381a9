package com.mk.fx.qa.loadgen.engine.scenario.extract;

import java.util.Objects;

/** Binds the value produced by {@code extractor} to {@code variable}. */
public record VariableExtraction(String variable, Extractor extractor) {

  public VariableExtraction {
    Objects.requireNonNull(variable, "variable");
    Objects.requireNonNull(extractor, "extractor");
  }

  public static VariableExtraction jsonPath(String variable, String path) {
    return new VariableExtraction(variable, new Extractor.JsonPath(path));
  }
}
