package com.mk.fx.qa.loadgen.engine.error;

import lombok.Getter;

/** Fatal configuration problem, raised while building models, scenarios or data sources. */
@Getter
public class LoadConfigException extends RuntimeException {

  private final EngineError.ConfigError error;

  public LoadConfigException(String field, String message) {
    this(field, message, null);
  }

  public LoadConfigException(String field, String message, Throwable cause) {
    super(field + ": " + message, cause);
    this.error = new EngineError.ConfigError(field, message);
  }
}
