package com.mk.fx.qa.loadgen.engine.scenario.extract;

/** A value could not be extracted from a response. */
public class ExtractionException extends Exception {

  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
